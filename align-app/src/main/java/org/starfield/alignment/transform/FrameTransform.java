package org.starfield.alignment.transform;

import java.io.Serializable;

/**
 * Invertible 2D affine mapping from candidate frame coordinates onto reference frame coordinates:
 *
 * <pre>
 *     x' = m00 * x + m01 * y + m02
 *     y' = m10 * x + m11 * y + m12
 * </pre>
 *
 * The inverse is derived analytically from the 2x2 linear part when the transform is built.
 * Estimated transforms also carry the number of supporting inliers and their RMS residual.
 */
public class FrameTransform
        implements Serializable {

    /** Smallest linear part determinant magnitude accepted as invertible. */
    public static final double MIN_DETERMINANT = 1e-12;

    private final ModelType modelType;
    private final double m00;
    private final double m01;
    private final double m02;
    private final double m10;
    private final double m11;
    private final double m12;

    private final double i00;
    private final double i01;
    private final double i02;
    private final double i10;
    private final double i11;
    private final double i12;

    private final int inlierCount;
    private final double rmsResidual;

    /**
     * @param  modelType  model that produced this transform (null for the identity / unestimated transforms).
     *
     * @throws IllegalArgumentException
     *   if the linear part is not invertible.
     */
    public FrameTransform(final ModelType modelType,
                          final double m00,
                          final double m01,
                          final double m02,
                          final double m10,
                          final double m11,
                          final double m12,
                          final int inlierCount,
                          final double rmsResidual)
            throws IllegalArgumentException {

        final double determinant = (m00 * m11) - (m01 * m10);
        if ((! Double.isFinite(determinant)) || (Math.abs(determinant) < MIN_DETERMINANT) ||
            (! Double.isFinite(m02)) || (! Double.isFinite(m12))) {
            throw new IllegalArgumentException("transform [" + m00 + ", " + m01 + ", " + m02 + "; " +
                                               m10 + ", " + m11 + ", " + m12 + "] is not invertible");
        }

        this.modelType = modelType;
        this.m00 = m00;
        this.m01 = m01;
        this.m02 = m02;
        this.m10 = m10;
        this.m11 = m11;
        this.m12 = m12;

        this.i00 = m11 / determinant;
        this.i01 = -m01 / determinant;
        this.i10 = -m10 / determinant;
        this.i11 = m00 / determinant;
        this.i02 = -((i00 * m02) + (i01 * m12));
        this.i12 = -((i10 * m02) + (i11 * m12));

        this.inlierCount = inlierCount;
        this.rmsResidual = rmsResidual;
    }

    public FrameTransform(final ModelType modelType,
                          final double m00,
                          final double m01,
                          final double m02,
                          final double m10,
                          final double m11,
                          final double m12)
            throws IllegalArgumentException {
        this(modelType, m00, m01, m02, m10, m11, m12, 0, 0.0);
    }

    public static FrameTransform identity() {
        return new FrameTransform(null, 1, 0, 0, 0, 1, 0);
    }

    /**
     * @param  theta  counter clockwise rotation angle in radians (in image coordinates with y pointing down
     *                this appears clockwise).
     * @param  scale  uniform scale factor.
     * @param  tx     x translation applied after rotation and scaling.
     * @param  ty     y translation applied after rotation and scaling.
     */
    public static FrameTransform similarity(final double theta,
                                            final double scale,
                                            final double tx,
                                            final double ty) {
        final double cos = scale * Math.cos(theta);
        final double sin = scale * Math.sin(theta);
        return new FrameTransform(ModelType.SIMILARITY, cos, -sin, tx, sin, cos, ty);
    }

    /**
     * @return similarity transform rotating by theta about the specified center.
     */
    public static FrameTransform rotationAbout(final double theta,
                                               final double centerX,
                                               final double centerY) {
        final double cos = Math.cos(theta);
        final double sin = Math.sin(theta);
        return similarity(theta,
                          1.0,
                          centerX - (cos * centerX) + (sin * centerY),
                          centerY - (sin * centerX) - (cos * centerY));
    }

    public ModelType getModelType() {
        return modelType;
    }

    public int getInlierCount() {
        return inlierCount;
    }

    public double getRmsResidual() {
        return rmsResidual;
    }

    public double[] getMatrix() {
        return new double[] { m00, m01, m02, m10, m11, m12 };
    }

    public double getDeterminant() {
        return (m00 * m11) - (m01 * m10);
    }

    /**
     * @return rotation angle in radians (exact for rigid and similarity transforms).
     */
    public double getRotation() {
        return Math.atan2(m10, m00);
    }

    /**
     * @return uniform scale (square root of the determinant magnitude).
     */
    public double getScale() {
        return Math.sqrt(Math.abs(getDeterminant()));
    }

    public double getTranslationX() {
        return m02;
    }

    public double getTranslationY() {
        return m12;
    }

    public boolean isIdentity() {
        return (m00 == 1.0) && (m01 == 0.0) && (m02 == 0.0) && (m10 == 0.0) && (m11 == 1.0) && (m12 == 0.0);
    }

    public double[] apply(final double x,
                          final double y) {
        return new double[] { (m00 * x) + (m01 * y) + m02, (m10 * x) + (m11 * y) + m12 };
    }

    public double[] applyInverse(final double x,
                                 final double y) {
        return new double[] { (i00 * x) + (i01 * y) + i02, (i10 * x) + (i11 * y) + i12 };
    }

    /**
     * Maps (x, y) into the specified array to avoid allocation in per-pixel loops.
     */
    public void applyInverseInPlace(final double x,
                                    final double y,
                                    final double[] target) {
        target[0] = (i00 * x) + (i01 * y) + i02;
        target[1] = (i10 * x) + (i11 * y) + i12;
    }

    /**
     * @return squared distance between the transferred point (x, y) and (targetX, targetY).
     */
    public double transferErrorSquared(final double x,
                                       final double y,
                                       final double targetX,
                                       final double targetY) {
        final double dx = (m00 * x) + (m01 * y) + m02 - targetX;
        final double dy = (m10 * x) + (m11 * y) + m12 - targetY;
        return (dx * dx) + (dy * dy);
    }

    public FrameTransform createInverse() {
        return new FrameTransform(modelType, i00, i01, i02, i10, i11, i12, inlierCount, rmsResidual);
    }

    /**
     * @return copy of this transform with the specified quality measures.
     */
    public FrameTransform withQuality(final int inlierCount,
                                      final double rmsResidual) {
        return new FrameTransform(modelType, m00, m01, m02, m10, m11, m12, inlierCount, rmsResidual);
    }

    @Override
    public String toString() {
        return String.format("{\"modelType\": \"%s\", \"matrix\": [%.6f, %.6f, %.3f, %.6f, %.6f, %.3f], " +
                             "\"inliers\": %d, \"rmsResidual\": %.4f}",
                             (modelType == null ? "IDENTITY" : modelType), m00, m01, m02, m10, m11, m12,
                             inlierCount, rmsResidual);
    }

}
