package io.surfworks.warplayout.ir;

/**
 * Base interface for IR types.
 */
public sealed interface Type permits ScalarType, PointerType, TensorType {
    String toMlirString();
}
