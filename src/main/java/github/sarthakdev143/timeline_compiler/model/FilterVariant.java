package github.sarthakdev143.timeline_compiler.model;

/**
 * Which family of geometric filters a hardware profile can drive.
 */
public enum FilterVariant {
    CPU,
    CUDA
}
