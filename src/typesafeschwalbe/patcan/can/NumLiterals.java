package typesafeschwalbe.patcan.can;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import typesafeschwalbe.patcan.frontend.Base;

public class NumLiterals {

    public enum IntWidth {
        U8(false, 8, "u8"),
        U16(false, 16, "u16"),
        U32(false, 32, "u32"),
        U64(false, 64, "u64"),
        U128(false, 128, "u128"),
        I8(true, 8, "i8"),
        I16(true, 16, "i16"),
        I32(true, 32, "i32"),
        I64(true, 64, "i64"),
        I128(true, 128, "i128"),
        NAT(false, 64, "nat");

        public final boolean isSigned;
        public final int bits;
        public final String suffix;

        private IntWidth(boolean isSigned, int bits, String suffix) {
            this.isSigned = isSigned;
            this.bits = bits;
            this.suffix = suffix;
        }

        public BigInteger maxValue() {
            return this.isSigned
                ? BigInteger.ONE.shiftLeft(this.bits - 1).subtract(BigInteger.ONE)
                : BigInteger.ONE.shiftLeft(this.bits).subtract(BigInteger.ONE);
        }

        public BigInteger minValue() {
            return this.isSigned
                ? BigInteger.ONE.shiftLeft(this.bits - 1).negate()
                : BigInteger.ZERO;
        }

        public boolean fits(BigInteger value) {
            return value.compareTo(this.minValue()) >= 0
                && value.compareTo(this.maxValue()) <= 0;
        }
    }

    public enum FloatWidth {
        DEC("dec"),
        F32("f32"),
        F64("f64");

        public final String suffix;

        private FloatWidth(String suffix) {
            this.suffix = suffix;
        }
    }

    public enum SignDemand {
        NO_DEMAND,
        SIGNED
    }

    // An integer value as written. Values above 'i128::MAX' are kept
    // as 'U128' so that they can not be negated by accident.
    public static record IntValue(boolean isU128, BigInteger value) {

        private static final BigInteger I128_MAX = IntWidth.I128.maxValue();

        public static IntValue of(BigInteger value) {
            return new IntValue(value.compareTo(I128_MAX) > 0, value);
        }

        public IntValue negate() {
            if(this.isU128) {
                throw new IllegalStateException(
                    "A u128 value can not be negated!"
                );
            }
            return new IntValue(false, this.value.negate());
        }

        @Override
        public String toString() {
            return (this.isU128? "u128 " : "i128 ") + this.value;
        }
    }

    public static record IntBound(
        Optional<IntWidth> exact, Optional<SignDemand> sign,
        Optional<IntWidth> atLeast
    ) {
        public static final IntBound NONE = new IntBound(
            Optional.empty(), Optional.empty(), Optional.empty()
        );

        public static IntBound exact(IntWidth width) {
            return new IntBound(
                Optional.of(width), Optional.empty(), Optional.empty()
            );
        }

        public static IntBound atLeast(SignDemand sign, IntWidth width) {
            return new IntBound(
                Optional.empty(), Optional.of(sign), Optional.of(width)
            );
        }

        @Override
        public String toString() {
            if(this.exact.isPresent()) {
                return "exactly " + this.exact.get().suffix;
            }
            if(this.atLeast.isPresent()) {
                return "at least " + this.atLeast.get().suffix
                    + (this.sign.get() == SignDemand.SIGNED? " (signed)" : "");
            }
            return "unbounded";
        }
    }

    public static record FloatBound(Optional<FloatWidth> exact) {
        public static final FloatBound NONE = new FloatBound(Optional.empty());

        public static FloatBound exact(FloatWidth width) {
            return new FloatBound(Optional.of(width));
        }

        @Override
        public String toString() {
            return this.exact.map(w -> "exactly " + w.suffix)
                .orElse("unbounded");
        }
    }

    public static record NumericBound(
        Optional<IntWidth> intExact, Optional<FloatWidth> floatExact,
        Optional<SignDemand> sign, Optional<IntWidth> atLeast
    ) {
        public static NumericBound atLeastIntOrFloat(
            SignDemand sign, IntWidth width
        ) {
            return new NumericBound(
                Optional.empty(), Optional.empty(),
                Optional.of(sign), Optional.of(width)
            );
        }

        @Override
        public String toString() {
            if(this.intExact.isPresent()) {
                return "exactly " + this.intExact.get().suffix;
            }
            if(this.floatExact.isPresent()) {
                return "exactly " + this.floatExact.get().suffix;
            }
            if(this.atLeast.isPresent()) {
                return "at least " + this.atLeast.get().suffix
                    + (this.sign.get() == SignDemand.SIGNED? " (signed)" : "");
            }
            return "unbounded";
        }
    }

    public static class ParsedNum {

        public enum Type {
            UNKNOWN_NUM, // IntValue + NumericBound
            INT,         // IntValue + IntBound
            FLOAT        // double + FloatBound
        }

        public final Type type;
        public final IntValue intValue;
        public final double floatValue;
        public final NumericBound numericBound;
        public final IntBound intBound;
        public final FloatBound floatBound;

        private ParsedNum(
            Type type, IntValue intValue, double floatValue,
            NumericBound numericBound, IntBound intBound, FloatBound floatBound
        ) {
            this.type = type;
            this.intValue = intValue;
            this.floatValue = floatValue;
            this.numericBound = numericBound;
            this.intBound = intBound;
            this.floatBound = floatBound;
        }

        static ParsedNum unknownNum(IntValue value, NumericBound bound) {
            return new ParsedNum(
                Type.UNKNOWN_NUM, value, 0.0, bound, null, null
            );
        }

        static ParsedNum integer(IntValue value, IntBound bound) {
            return new ParsedNum(Type.INT, value, 0.0, null, bound, null);
        }

        static ParsedNum floating(double value, FloatBound bound) {
            return new ParsedNum(Type.FLOAT, null, value, null, null, bound);
        }

    }

    public static record ParsedFloat(
        String textWithoutSuffix, double value, FloatBound bound
    ) {}

    public static record ParsedInt(IntValue value, IntBound bound) {}

    public static class MalformedLiteralException extends Exception {

        public enum Kind {
            EMPTY,
            INVALID_DIGIT,
            OVERFLOW,
            UNDERFLOW,
            FLOAT_SUFFIX,
            INT_SUFFIX,
            NOT_FINITE
        }

        public final Kind kind;
        public final String text;

        public MalformedLiteralException(Kind kind, String text) {
            super("'" + text + "' is malformed: " + kind);
            this.kind = kind;
            this.text = text;
        }

    }

    private static record Suffixed(
        String digits, Optional<IntWidth> intWidth,
        Optional<FloatWidth> floatWidth
    ) {}

    private static final List<IntWidth> SUFFIX_ORDER = List.of(
        IntWidth.I128, IntWidth.U128, IntWidth.NAT,
        IntWidth.I16, IntWidth.I32, IntWidth.I64,
        IntWidth.U16, IntWidth.U32, IntWidth.U64,
        IntWidth.I8, IntWidth.U8
    );

    private static Suffixed splitSuffix(String raw, boolean allowFloatSuffix) {
        for(IntWidth width: SUFFIX_ORDER) {
            if(raw.endsWith(width.suffix)) {
                return new Suffixed(
                    raw.substring(0, raw.length() - width.suffix.length()),
                    Optional.of(width), Optional.empty()
                );
            }
        }
        if(allowFloatSuffix) {
            for(FloatWidth width: FloatWidth.values()) {
                if(raw.endsWith(width.suffix)) {
                    return new Suffixed(
                        raw.substring(0, raw.length() - width.suffix.length()),
                        Optional.empty(), Optional.of(width)
                    );
                }
            }
        }
        return new Suffixed(raw, Optional.empty(), Optional.empty());
    }

    static IntWidth lowerBoundOfInt(BigInteger value) {
        if(value.signum() >= 0) {
            if(value.compareTo(IntWidth.U64.maxValue()) > 0) { return IntWidth.I128; }
            if(value.compareTo(IntWidth.I64.maxValue()) > 0) { return IntWidth.U64; }
            if(value.compareTo(IntWidth.U32.maxValue()) > 0) { return IntWidth.I64; }
            if(value.compareTo(IntWidth.I32.maxValue()) > 0) { return IntWidth.U32; }
            if(value.compareTo(IntWidth.U16.maxValue()) > 0) { return IntWidth.I32; }
            if(value.compareTo(IntWidth.I16.maxValue()) > 0) { return IntWidth.U16; }
            if(value.compareTo(IntWidth.U8.maxValue()) > 0) { return IntWidth.I16; }
            if(value.compareTo(IntWidth.I8.maxValue()) > 0) { return IntWidth.U8; }
            return IntWidth.I8;
        }
        if(value.compareTo(IntWidth.I64.minValue()) < 0) { return IntWidth.I128; }
        if(value.compareTo(IntWidth.I32.minValue()) < 0) { return IntWidth.I64; }
        if(value.compareTo(IntWidth.I16.minValue()) < 0) { return IntWidth.I32; }
        if(value.compareTo(IntWidth.I8.minValue()) < 0) { return IntWidth.I16; }
        return IntWidth.I8;
    }

    private static BigInteger parseDigits(
        String raw, String digits, int radix
    ) throws MalformedLiteralException {
        String cleaned = digits.replace("_", "");
        boolean isNegative = cleaned.startsWith("-");
        String magnitude = isNegative? cleaned.substring(1) : cleaned;
        if(magnitude.isEmpty()) {
            throw new MalformedLiteralException(
                MalformedLiteralException.Kind.EMPTY, raw
            );
        }
        for(int charIdx = 0; charIdx < magnitude.length(); charIdx += 1) {
            if(Character.digit(magnitude.charAt(charIdx), radix) == -1) {
                throw new MalformedLiteralException(
                    MalformedLiteralException.Kind.INVALID_DIGIT, raw
                );
            }
        }
        BigInteger value = new BigInteger(magnitude, radix);
        if(isNegative) {
            value = value.negate();
        }
        if(value.compareTo(IntWidth.U128.maxValue()) > 0) {
            throw new MalformedLiteralException(
                MalformedLiteralException.Kind.OVERFLOW, raw
            );
        }
        if(value.compareTo(IntWidth.I128.minValue()) < 0) {
            throw new MalformedLiteralException(
                MalformedLiteralException.Kind.UNDERFLOW, raw
            );
        }
        return value;
    }

    // 'negated' literals are checked against their suffix width as if the
    // sign had already been applied to the returned magnitude
    private static ParsedNum fromStrRadix(
        String raw, int radix, boolean negated
    ) throws MalformedLiteralException {
        // hexadecimal digits overlap with the float suffixes
        Suffixed suffixed = NumLiterals.splitSuffix(raw, radix == 10);
        BigInteger value = NumLiterals.parseDigits(
            raw, suffixed.digits(), radix
        );
        IntValue intValue = IntValue.of(value);
        boolean isNegative = value.signum() < 0;
        IntWidth lowerBound = intValue.isU128()
            ? IntWidth.U128
            : NumLiterals.lowerBoundOfInt(value);
        if(suffixed.floatWidth().isPresent()) {
            return ParsedNum.floating(
                value.doubleValue(), FloatBound.exact(suffixed.floatWidth().get())
            );
        }
        if(suffixed.intWidth().isPresent()) {
            IntWidth exact = suffixed.intWidth().get();
            BigInteger signedValue = negated? value.negate() : value;
            if(!exact.fits(signedValue)) {
                throw new MalformedLiteralException(
                    signedValue.signum() < 0
                        ? MalformedLiteralException.Kind.UNDERFLOW
                        : MalformedLiteralException.Kind.OVERFLOW,
                    raw
                );
            }
            return ParsedNum.integer(intValue, IntBound.exact(exact));
        }
        SignDemand sign = isNegative? SignDemand.SIGNED : SignDemand.NO_DEMAND;
        return ParsedNum.unknownNum(
            intValue, NumericBound.atLeastIntOrFloat(sign, lowerBound)
        );
    }

    public static ParsedNum finishParsingNum(
        String raw
    ) throws MalformedLiteralException {
        return NumLiterals.fromStrRadix(raw, 10, false);
    }

    // Parses the digits of a literal written with a base prefix. The sign is
    // not applied to the returned value, only to the bound and the check
    // against a width suffix.
    public static ParsedInt finishParsingBase(
        String raw, Base base, boolean isNegative
    ) throws MalformedLiteralException {
        ParsedNum parsed = NumLiterals.fromStrRadix(
            raw, base.radix, isNegative
        );
        switch(parsed.type) {
            case FLOAT: {
                throw new MalformedLiteralException(
                    MalformedLiteralException.Kind.FLOAT_SUFFIX, raw
                );
            }
            case INT: {
                if(isNegative && !parsed.intBound.exact().get().isSigned) {
                    throw new MalformedLiteralException(
                        MalformedLiteralException.Kind.UNDERFLOW, raw
                    );
                }
                return new ParsedInt(parsed.intValue, parsed.intBound);
            }
            case UNKNOWN_NUM: {
                if(!isNegative || parsed.intValue.isU128()) {
                    return new ParsedInt(
                        parsed.intValue,
                        IntBound.atLeast(
                            parsed.numericBound.sign().get(),
                            parsed.numericBound.atLeast().get()
                        )
                    );
                }
                BigInteger negated = parsed.intValue.value().negate();
                return new ParsedInt(
                    parsed.intValue,
                    IntBound.atLeast(
                        SignDemand.SIGNED, NumLiterals.lowerBoundOfInt(negated)
                    )
                );
            }
            default:
                throw new RuntimeException("unhandled number kind!");
        }
    }

    public static ParsedFloat finishParsingFloat(
        String raw
    ) throws MalformedLiteralException {
        Suffixed suffixed = NumLiterals.splitSuffix(raw, true);
        if(suffixed.intWidth().isPresent()) {
            throw new MalformedLiteralException(
                MalformedLiteralException.Kind.INT_SUFFIX, raw
            );
        }
        String digits = suffixed.digits().replace("_", "");
        if(digits.isEmpty()) {
            throw new MalformedLiteralException(
                MalformedLiteralException.Kind.EMPTY, raw
            );
        }
        for(int charIdx = 0; charIdx < digits.length(); charIdx += 1) {
            char c = digits.charAt(charIdx);
            boolean allowed = Character.isDigit(c)
                || c == '.' || c == 'e' || c == '-' || c == '+';
            if(!allowed) {
                throw new MalformedLiteralException(
                    MalformedLiteralException.Kind.INVALID_DIGIT, raw
                );
            }
        }
        double value;
        try {
            value = Double.parseDouble(digits);
        } catch(NumberFormatException e) {
            throw new MalformedLiteralException(
                MalformedLiteralException.Kind.INVALID_DIGIT, raw
            );
        }
        boolean isF32 = suffixed.floatWidth().isPresent()
            && suffixed.floatWidth().get() == FloatWidth.F32;
        if(Double.isInfinite(value) || Double.isNaN(value)
            || (isF32 && Float.isInfinite((float) value))) {
            throw new MalformedLiteralException(
                MalformedLiteralException.Kind.NOT_FINITE, raw
            );
        }
        FloatBound bound = suffixed.floatWidth().isPresent()
            ? FloatBound.exact(suffixed.floatWidth().get())
            : FloatBound.NONE;
        return new ParsedFloat(suffixed.digits(), value, bound);
    }

    private NumLiterals() {}

}
