package org.cpoanalyzer.polefigure;

/**
 * How the top of the color scale is derived from the shared maximum density.
 * Dividing the maximum saturates the strongest peaks and brings out weak fabric.
 */
public enum ColorScaleMethod {
    FULL("full", 1.0, ""),
    DIVIDE_2("divide 2", 2.0, "/2"),
    DIVIDE_3("divide 3", 3.0, "/3"),
    DIVIDE_4("divide 4", 4.0, "/4");

    private final String configName;
    private final double divisor;
    private final String legendSuffix;

    ColorScaleMethod(String configName, double divisor, String legendSuffix) {
        this.configName = configName;
        this.divisor = divisor;
        this.legendSuffix = legendSuffix;
    }

    /**
     * Parses the configured value. Unknown values fall back to {@link #FULL}, as the
     * plotting code always did for anything that is not a divide option.
     *
     * @param name configured name, e.g. {@code "divide 2"}.
     * @return the method.
     */
    public static ColorScaleMethod fromConfigName(String name) {
        for (ColorScaleMethod method : values()) {
            if (method.configName.equals(name)) {
                return method;
            }
        }
        return FULL;
    }

    /**
     * Top of the color scale for a given shared maximum.
     *
     * @param maxCount shared maximum.
     * @return {@code maxCount / divisor}.
     */
    public double scaleTop(double maxCount) {
        return maxCount / divisor;
    }

    public String configName() {
        return configName;
    }

    public String legendSuffix() {
        return legendSuffix;
    }
}
