package io.surfworks.warplayout.ir;

/**
 * Scalar element types: f16, bf16, f32, f64, i1, i8, i16, i32, i64.
 */
public record ScalarType(String name) implements Type {
    public static final ScalarType F16 = new ScalarType("f16");
    public static final ScalarType BF16 = new ScalarType("bf16");
    public static final ScalarType F32 = new ScalarType("f32");
    public static final ScalarType F64 = new ScalarType("f64");
    public static final ScalarType I1 = new ScalarType("i1");
    public static final ScalarType I8 = new ScalarType("i8");
    public static final ScalarType I16 = new ScalarType("i16");
    public static final ScalarType I32 = new ScalarType("i32");
    public static final ScalarType I64 = new ScalarType("i64");

    public static ScalarType of(String name) {
        return switch (name) {
            case "f16" -> F16;
            case "bf16" -> BF16;
            case "f32" -> F32;
            case "f64" -> F64;
            case "i1" -> I1;
            case "i8" -> I8;
            case "i16" -> I16;
            case "i32" -> I32;
            case "i64" -> I64;
            default -> new ScalarType(name);
        };
    }

    public boolean isFloatingPoint() {
        return name.startsWith("f") || name.equals("bf16");
    }

    public boolean isInteger() {
        return name.startsWith("i");
    }

    public int bitWidth() {
        String digits = name.equals("bf16") ? "16" : name.substring(1);
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Unknown bit width for scalar type " + name, e);
        }
    }

    @Override
    public String toMlirString() {
        return name;
    }
}
