package org.starfield.alignment.transform;

import java.io.Serializable;
import java.util.function.Supplier;

/**
 * Utility to map an enumeration of supported model names to fitter instances.
 */
public enum ModelType {

    RIGID( (FitterSupplier) RigidFitter::new ),
    SIMILARITY( (FitterSupplier) SimilarityFitter::new ),
    AFFINE( (FitterSupplier) AffineFitter::new );

    private final FitterSupplier supplier;

    ModelType(final FitterSupplier supplier) {
        this.supplier = supplier;
    }

    public TransformFitter getFitter() {
        return supplier.get();
    }

    /**
     * @return minimum number of correspondences needed to fit this model.
     */
    public int getMinNumMatches() {
        return getFitter().getMinNumMatches();
    }

    @SuppressWarnings("serial")
    private interface FitterSupplier extends Supplier<TransformFitter>, Serializable {
    }

}
