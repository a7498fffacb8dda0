package org.cpoanalyzer.cli.rendering;

/**
 * Color gradients for density maps, as 256-entry lookup tables.
 * <p>
 * All gradients except {@link #SIMPLE} approximate the scientific colour maps of
 * Fabio Crameri (http://www.fabiocrameri.ch/colourmaps.php) by linear interpolation
 * between control points.
 */
public enum ColorGradient {
    BATLOW("Batlow", new int[][] {
        {0,   1,   25,  89},
        {32,  16,  63,  96},
        {64,  28,  90,  98},
        {96,  60,  109, 86},
        {128, 104, 123, 62},
        {160, 157, 137, 43},
        {192, 210, 147, 67},
        {224, 248, 161, 123},
        {255, 250, 204, 250}
    }),
    VIK("Vik", new int[][] {
        {0,   0,   18,  97},
        {32,  2,   60,  130},
        {64,  30,  110, 165},
        {96,  130, 175, 205},
        {128, 235, 235, 232},
        {160, 215, 170, 130},
        {192, 190, 110, 60},
        {224, 145, 45,  15},
        {255, 89,  0,   8}
    }),
    IMOLA("Imola", new int[][] {
        {0,   26,  51,  179},
        {64,  36,  86,  166},
        {128, 63,  136, 141},
        {192, 125, 196, 112},
        {255, 255, 255, 102}
    }),
    HAWAII("Hawaii", new int[][] {
        {0,   140, 2,   115},
        {64,  152, 70,  69},
        {128, 158, 136, 37},
        {192, 103, 198, 140},
        {255, 179, 242, 253}
    }),
    ROMA("Roma", new int[][] {
        {0,   126, 23,  0},
        {64,  191, 134, 42},
        {128, 235, 235, 180},
        {192, 90,  170, 210},
        {255, 3,   49,  153}
    }),
    SIMPLE("Simple", new int[][] {
        {0,   255, 255, 255},
        {255, 255, 0,   0}
    });

    private final String configName;
    private final int[] lut;

    ColorGradient(String configName, int[][] controlPoints) {
        this.configName = configName;
        this.lut = generateLUT(controlPoints);
    }

    /**
     * @param name configured name, e.g. {@code Batlow}.
     * @return the gradient.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static ColorGradient fromConfigName(String name) {
        for (ColorGradient gradient : values()) {
            if (gradient.configName.equals(name)) {
                return gradient;
            }
        }
        throw new IllegalArgumentException("Unknown color scale '" + name
                + "', expected Batlow, Vik, Imola, Hawaii, Roma or Simple");
    }

    public String configName() {
        return configName;
    }

    /**
     * Looks up a color.
     *
     * @param t position on the gradient; clamped to [0, 1], NaN maps to 0.
     * @return packed RGB.
     */
    public int rgbAt(double t) {
        if (Double.isNaN(t) || t <= 0) {
            return lut[0];
        }
        if (t >= 1) {
            return lut[255];
        }
        return lut[(int) (t * 255.0 + 0.5)];
    }

    /**
     * Interpolates the control points ({@code {index, r, g, b}}) into 256 packed RGB values.
     */
    private static int[] generateLUT(int[][] cp) {
        int[] lut = new int[256];
        int cpIdx = 0;

        for (int i = 0; i < 256; i++) {
            while (cpIdx < cp.length - 2 && cp[cpIdx + 1][0] <= i) {
                cpIdx++;
            }

            float t = (float) (i - cp[cpIdx][0]) / (cp[cpIdx + 1][0] - cp[cpIdx][0]);
            t = Math.max(0, Math.min(1, t));

            int r = Math.round(cp[cpIdx][1] + (cp[cpIdx + 1][1] - cp[cpIdx][1]) * t);
            int g = Math.round(cp[cpIdx][2] + (cp[cpIdx + 1][2] - cp[cpIdx][2]) * t);
            int b = Math.round(cp[cpIdx][3] + (cp[cpIdx + 1][3] - cp[cpIdx][3]) * t);

            lut[i] = (r << 16) | (g << 8) | b;
        }

        return lut;
    }
}
