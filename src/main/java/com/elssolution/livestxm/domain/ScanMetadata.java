package com.elssolution.livestxm.domain;

import lombok.Builder;
import lombok.Value;

/**
 * One per scan, announced before the first frame. Immutable; a new instance
 * replaces the whole map state downstream.
 *
 * Grid orientation: x is the fast axis (columns), y the slow axis (rows).
 */
@Value
@Builder(toBuilder = true)
public class ScanMetadata {
    String scanId;

    double xStart;
    double xStop;
    int    xNum;
    double xStep;

    double yStart;
    double yStop;
    int    yNum;
    double yStep;

    double exposureTimeS;

    int detectorHeight;
    int detectorWidth;

    public int rows()         { return yNum; }
    public int cols()         { return xNum; }
    public int totalPoints()  { return xNum * yNum; }

    /** Motor travels from high to low x. */
    public boolean invertX()  { return xStart > xStop; }

    /** Motor travels from high to low y. */
    public boolean invertY()  { return yStart > yStop; }

    public double xMin() { return Math.min(xStart, xStop); }
    public double xMax() { return Math.max(xStart, xStop); }
    public double yMin() { return Math.min(yStart, yStop); }
    public double yMax() { return Math.max(yStart, yStop); }

    /** Step derived from the travel when the source did not send one. */
    public static double derivedStep(double start, double stop, int num) {
        return num > 0 ? Math.abs(stop - start) / num : 0.0;
    }
}
