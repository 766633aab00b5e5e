package mattrack.tracker.model;

/**
 * Periodicity class of a material's structure.
 */
public enum Dimensionality {
    /** 3D periodic bulk */
    CRYSTAL,
    /** 2D periodic surface */
    SLAB,
    /** 1D periodic chain */
    POLYMER,
    /** Non-periodic */
    MOLECULE
}
