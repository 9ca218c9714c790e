package org.starfield.alignment.transform;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link FrameTransform} class.
 */
public class FrameTransformTest {

    @Test
    public void testInverse() {

        final FrameTransform transform = new FrameTransform(ModelType.AFFINE, 1.1, 0.2, 15.0, -0.1, 0.9, -4.0);

        final double[] mapped = transform.apply(33.0, 71.0);
        final double[] restored = transform.applyInverse(mapped[0], mapped[1]);
        Assert.assertEquals("invalid x", 33.0, restored[0], 1e-9);
        Assert.assertEquals("invalid y", 71.0, restored[1], 1e-9);

        final double[] target = new double[2];
        transform.applyInverseInPlace(mapped[0], mapped[1], target);
        Assert.assertArrayEquals("in place inverse differs", restored, target, 0.0);

        final double[] inverseMapped = transform.createInverse().apply(mapped[0], mapped[1]);
        Assert.assertArrayEquals("created inverse differs", restored, inverseMapped, 1e-9);
    }

    @Test
    public void testRotationAbout() {

        final FrameTransform rotation = FrameTransform.rotationAbout(Math.toRadians(90), 100.0, 100.0);

        final double[] center = rotation.apply(100.0, 100.0);
        Assert.assertEquals("center x should not move", 100.0, center[0], 1e-9);
        Assert.assertEquals("center y should not move", 100.0, center[1], 1e-9);

        final double[] rotated = rotation.apply(110.0, 100.0);
        Assert.assertEquals("invalid rotated x", 100.0, rotated[0], 1e-9);
        Assert.assertEquals("invalid rotated y", 110.0, rotated[1], 1e-9);

        Assert.assertEquals("invalid rotation", Math.PI / 2, rotation.getRotation(), 1e-9);
        Assert.assertEquals("invalid scale", 1.0, rotation.getScale(), 1e-9);
    }

    @Test
    public void testIdentity() {
        final FrameTransform identity = FrameTransform.identity();
        Assert.assertTrue("identity not recognized", identity.isIdentity());
        Assert.assertNull("identity should not have a model type", identity.getModelType());
        Assert.assertFalse("translation recognized as identity",
                           FrameTransform.similarity(0.0, 1.0, 0.5, 0.0).isIdentity());
    }

    @Test
    public void testTransferError() {
        final FrameTransform shift = FrameTransform.similarity(0.0, 1.0, 3.0, 4.0);
        Assert.assertEquals("invalid transfer error", 25.0, shift.transferErrorSquared(0, 0, 0, 0), 1e-9);
        Assert.assertEquals("invalid transfer error", 0.0, shift.transferErrorSquared(0, 0, 3, 4), 1e-9);
    }

    @Test
    public void testWithQuality() {
        final FrameTransform transform = FrameTransform.similarity(0.3, 1.0, 1.0, 2.0).withQuality(17, 0.25);
        Assert.assertEquals("invalid inlier count", 17, transform.getInlierCount());
        Assert.assertEquals("invalid residual", 0.25, transform.getRmsResidual(), 0.0);
        Assert.assertEquals("quality should carry over to inverse", 17, transform.createInverse().getInlierCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testSingularTransformRejected() {
        new FrameTransform(ModelType.AFFINE, 1.0, 2.0, 0.0, 2.0, 4.0, 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFiniteTransformRejected() {
        new FrameTransform(ModelType.AFFINE, 1.0, 0.0, Double.NaN, 0.0, 1.0, 0.0);
    }

}
