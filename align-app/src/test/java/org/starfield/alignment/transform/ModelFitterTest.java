package org.starfield.alignment.transform;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.starfield.alignment.DegenerateGeometryException;
import org.starfield.alignment.match.Correspondence;

/**
 * Tests the {@link RigidFitter}, {@link SimilarityFitter}, and {@link AffineFitter} classes.
 */
public class ModelFitterTest {

    @Test
    public void testMinNumMatches() {
        Assert.assertEquals(2, ModelType.RIGID.getMinNumMatches());
        Assert.assertEquals(2, ModelType.SIMILARITY.getMinNumMatches());
        Assert.assertEquals(3, ModelType.AFFINE.getMinNumMatches());
    }

    @Test
    public void testRigidIgnoresScale()
            throws DegenerateGeometryException {

        // references are the candidates scaled by 2 about the origin
        final List<Correspondence> correspondences = Arrays.asList(new Correspondence(-10, 0, -20, 0),
                                                                   new Correspondence(10, 0, 20, 0));

        final FrameTransform rigid = new RigidFitter().fit(correspondences);
        Assert.assertEquals("rigid fit should not scale", 1.0, rigid.getScale(), 1e-9);
        Assert.assertEquals("rigid fit should not rotate", 0.0, rigid.getRotation(), 1e-9);

        final FrameTransform similarity = new SimilarityFitter().fit(correspondences);
        Assert.assertEquals("invalid similarity scale", 2.0, similarity.getScale(), 1e-9);
    }

    @Test
    public void testTwoPointSimilarityIsExact()
            throws DegenerateGeometryException {

        final FrameTransform expected = FrameTransform.similarity(1.2, 0.8, -3.0, 40.0);
        final double[] a = expected.apply(10, 20);
        final double[] b = expected.apply(50, 5);

        final FrameTransform fit = new SimilarityFitter().fit(Arrays.asList(new Correspondence(10, 20, a[0], a[1]),
                                                                            new Correspondence(50, 5, b[0], b[1])));

        Assert.assertArrayEquals("invalid matrix", expected.getMatrix(), fit.getMatrix(), 1e-9);
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testCoincidentCandidates()
            throws DegenerateGeometryException {
        new SimilarityFitter().fit(Arrays.asList(new Correspondence(10, 10, 0, 0),
                                                 new Correspondence(10, 10, 5, 5)));
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testCoincidentReferencesForRigid()
            throws DegenerateGeometryException {
        new RigidFitter().fit(Arrays.asList(new Correspondence(0, 0, 5, 5),
                                            new Correspondence(10, 10, 5, 5)));
    }

    @Test(expected = DegenerateGeometryException.class)
    public void testCollinearAffine()
            throws DegenerateGeometryException {
        new AffineFitter().fit(Arrays.asList(new Correspondence(0, 0, 0, 0),
                                             new Correspondence(1, 2, 3, 1),
                                             new Correspondence(2, 4, 7, 9)));
    }

}
