package work.shellformats.toml.value;

/**
 * Host-defined value carried through the pipeline without a structural representation.
 */
public interface CustomValue {
    String typeName();
}
