package com.acme.corna.media;

import java.math.BigInteger;

public final class AspectRatios {
    private static final double TOLERANCE = 0.02;

    private static final String[] LABELS = {
            "16/9", "4/3", "3/2", "1/1", "21/9", "18/9", "2/1", "5/4",
            "9/16", "10/16", "9/18", "3/4", "2/3", "1/2", "1/1.91"
    };
    private static final double[] RATIOS = {
            16.0 / 9, 4.0 / 3, 3.0 / 2, 1.0, 21.0 / 9, 18.0 / 9, 2.0, 5.0 / 4,
            9.0 / 16, 10.0 / 16, 9.0 / 18, 3.0 / 4, 2.0 / 3, 1.0 / 2, 1 / 1.91
    };

    private AspectRatios() {}

    /**
     * Nearest common ratio when within 2% of the real one, otherwise the reduced fraction.
     */
    public static String of(int width, int height) {
        if (height == 0) throw new IllegalArgumentException("Height cannot be zero");
        double actual = (double) width / height;

        int best = 0;
        for (int i = 1; i < RATIOS.length; i++) {
            if (Math.abs(RATIOS[i] - actual) < Math.abs(RATIOS[best] - actual)) best = i;
        }
        double error = Math.abs(RATIOS[best] - actual) / actual;
        if (error <= TOLERANCE) return LABELS[best];

        int gcd = BigInteger.valueOf(width).gcd(BigInteger.valueOf(height)).intValue();
        return (width / gcd) + "/" + (height / gcd);
    }
}
