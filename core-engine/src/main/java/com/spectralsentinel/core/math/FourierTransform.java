package com.spectralsentinel.core.math;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.Arrays;
import java.util.Objects;

/**
 * Discrete Fourier transform of arbitrary length.
 *
 * <p>
 * Conventions: the forward transform is unscaled,
 * {@code X[k] = sum_j x[j] * exp(-2*pi*i*j*k/n)}, and the inverse divides by
 * {@code n}, so {@code inverse(forward(x)) == x} up to rounding.
 * </p>
 *
 * <p>
 * Power-of-two lengths are handed to Commons Math's radix-2
 * {@link FastFourierTransformer}. Any other length is rewritten as a circular
 * convolution (Bluestein's chirp-z algorithm) and evaluated with the same
 * radix-2 transformer on a padded power-of-two buffer, so every length costs
 * {@code O(n log n)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FourierTransform {

    private static final FastFourierTransformer FFT = new FastFourierTransformer(DftNormalization.STANDARD);

    private FourierTransform() {
        // utility class, not instantiable
    }

    /**
     * Forward transform of a real-valued sequence.
     *
     * @param values input samples; must not be {@code null} or empty
     * @return the {@code values.length} complex coefficients
     */
    public static Complex[] forward(double[] values) {
        Objects.requireNonNull(values, "values must not be null");
        Complex[] data = new Complex[values.length];
        for (int i = 0; i < values.length; i++) {
            data[i] = new Complex(values[i], 0.0);
        }
        return forward(data);
    }

    /**
     * Forward transform of a complex sequence. The input is not modified.
     *
     * @param data input samples; must not be {@code null} or empty
     * @return the transformed coefficients
     */
    public static Complex[] forward(Complex[] data) {
        requireNonEmpty(data);
        if (ArithmeticUtils.isPowerOfTwo(data.length)) {
            return FFT.transform(data, TransformType.FORWARD);
        }
        return bluestein(data);
    }

    /**
     * Inverse transform, scaled by {@code 1/n}. The input is not modified.
     *
     * @param data frequency-domain coefficients; must not be {@code null} or
     *             empty
     * @return the time-domain samples
     */
    public static Complex[] inverse(Complex[] data) {
        requireNonEmpty(data);
        int n = data.length;
        if (ArithmeticUtils.isPowerOfTwo(n)) {
            return FFT.transform(data, TransformType.INVERSE);
        }
        // ifft(x) = conj(fft(conj(x))) / n
        Complex[] conjugated = new Complex[n];
        for (int i = 0; i < n; i++) {
            conjugated[i] = data[i].conjugate();
        }
        Complex[] transformed = bluestein(conjugated);
        Complex[] result = new Complex[n];
        for (int i = 0; i < n; i++) {
            result[i] = transformed[i].conjugate().divide(n);
        }
        return result;
    }

    /**
     * @return {@code sqrt(re^2 + im^2)} of every element
     */
    public static double[] magnitudes(Complex[] data) {
        double[] result = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double re = data[i].getReal();
            double im = data[i].getImaginary();
            result[i] = Math.sqrt(re * re + im * im);
        }
        return result;
    }

    // ---------------------------------------------------------------
    // Bluestein
    // ---------------------------------------------------------------

    private static Complex[] bluestein(Complex[] data) {
        int n = data.length;
        int m = Integer.highestOneBit(2 * n - 1);
        if (m < 2 * n - 1) {
            m <<= 1;
        }

        // chirp[k] = exp(-i*pi*k^2/n); k^2 is reduced mod 2n to keep the angle small
        Complex[] chirp = new Complex[n];
        long period = 2L * n;
        for (int k = 0; k < n; k++) {
            long k2 = ((long) k * k) % period;
            double angle = Math.PI * k2 / n;
            chirp[k] = new Complex(Math.cos(angle), -Math.sin(angle));
        }

        Complex[] a = new Complex[m];
        Complex[] b = new Complex[m];
        Arrays.fill(a, Complex.ZERO);
        Arrays.fill(b, Complex.ZERO);
        for (int k = 0; k < n; k++) {
            a[k] = data[k].multiply(chirp[k]);
        }
        b[0] = chirp[0].conjugate();
        for (int k = 1; k < n; k++) {
            Complex c = chirp[k].conjugate();
            b[k] = c;
            b[m - k] = c;
        }

        Complex[] fa = FFT.transform(a, TransformType.FORWARD);
        Complex[] fb = FFT.transform(b, TransformType.FORWARD);
        Complex[] product = new Complex[m];
        for (int i = 0; i < m; i++) {
            product[i] = fa[i].multiply(fb[i]);
        }
        Complex[] convolution = FFT.transform(product, TransformType.INVERSE);

        Complex[] result = new Complex[n];
        for (int k = 0; k < n; k++) {
            result[k] = convolution[k].multiply(chirp[k]);
        }
        return result;
    }

    private static void requireNonEmpty(Complex[] data) {
        Objects.requireNonNull(data, "data must not be null");
        if (data.length == 0) {
            throw new IllegalArgumentException("Cannot transform an empty sequence");
        }
    }
}
