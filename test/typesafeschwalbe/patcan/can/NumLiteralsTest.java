package typesafeschwalbe.patcan.can;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import typesafeschwalbe.patcan.can.NumLiterals.FloatBound;
import typesafeschwalbe.patcan.can.NumLiterals.FloatWidth;
import typesafeschwalbe.patcan.can.NumLiterals.IntBound;
import typesafeschwalbe.patcan.can.NumLiterals.IntWidth;
import typesafeschwalbe.patcan.can.NumLiterals.MalformedLiteralException;
import typesafeschwalbe.patcan.can.NumLiterals.NumericBound;
import typesafeschwalbe.patcan.can.NumLiterals.ParsedNum;
import typesafeschwalbe.patcan.can.NumLiterals.SignDemand;
import typesafeschwalbe.patcan.frontend.Base;

public class NumLiteralsTest {

    private static MalformedLiteralException.Kind failure(
        org.junit.jupiter.api.function.Executable parse
    ) {
        return assertThrows(MalformedLiteralException.class, parse).kind;
    }

    @ParameterizedTest
    @CsvSource({
        "0, NO_DEMAND, I8",
        "127, NO_DEMAND, I8",
        "128, NO_DEMAND, U8",
        "1_000, NO_DEMAND, I16",
        "-128, SIGNED, I8",
        "-129, SIGNED, I16",
        "4294967296, NO_DEMAND, I64",
        "-9223372036854775809, SIGNED, I128"
    })
    @DisplayName("Unsuffixed integers get the smallest width that holds them")
    void unsuffixedBounds(String raw, SignDemand sign, IntWidth width)
            throws MalformedLiteralException {
        ParsedNum parsed = NumLiterals.finishParsingNum(raw);
        assertEquals(ParsedNum.Type.UNKNOWN_NUM, parsed.type);
        assertEquals(
            NumericBound.atLeastIntOrFloat(sign, width), parsed.numericBound
        );
        assertEquals(
            new BigInteger(raw.replace("_", "")), parsed.intValue.value()
        );
    }

    @Test
    @DisplayName("An integer suffix fixes the width")
    void integerSuffixes() throws MalformedLiteralException {
        ParsedNum parsed = NumLiterals.finishParsingNum("255u8");
        assertEquals(ParsedNum.Type.INT, parsed.type);
        assertEquals(IntBound.exact(IntWidth.U8), parsed.intBound);
        assertEquals(BigInteger.valueOf(255), parsed.intValue.value());

        assertEquals(
            IntBound.exact(IntWidth.I128),
            NumLiterals.finishParsingNum("-5i128").intBound
        );
        assertEquals(
            IntBound.exact(IntWidth.NAT),
            NumLiterals.finishParsingNum("7nat").intBound
        );
        assertEquals(
            BigInteger.valueOf(-128),
            NumLiterals.finishParsingNum("-128i8").intValue.value()
        );
    }

    @Test
    @DisplayName("A value outside of its suffix's range is rejected")
    void suffixRange() {
        assertEquals(
            MalformedLiteralException.Kind.OVERFLOW,
            failure(() -> NumLiterals.finishParsingNum("256u8"))
        );
        assertEquals(
            MalformedLiteralException.Kind.OVERFLOW,
            failure(() -> NumLiterals.finishParsingNum("128i8"))
        );
        assertEquals(
            MalformedLiteralException.Kind.UNDERFLOW,
            failure(() -> NumLiterals.finishParsingNum("-1u8"))
        );
    }

    @Test
    @DisplayName("A float suffix on an integer makes it a float")
    void floatSuffixOnInteger() throws MalformedLiteralException {
        ParsedNum parsed = NumLiterals.finishParsingNum("3dec");
        assertEquals(ParsedNum.Type.FLOAT, parsed.type);
        assertEquals(FloatBound.exact(FloatWidth.DEC), parsed.floatBound);
        assertEquals(3.0, parsed.floatValue);
        assertEquals(
            FloatBound.exact(FloatWidth.F64),
            NumLiterals.finishParsingNum("3f64").floatBound
        );
    }

    @Test
    @DisplayName("Values above the largest i128 are kept as u128")
    void u128Values() throws MalformedLiteralException {
        ParsedNum parsed = NumLiterals.finishParsingNum(
            "170141183460469231731687303715884105728"
        );
        assertTrue(parsed.intValue.isU128());
        assertEquals(
            NumericBound.atLeastIntOrFloat(SignDemand.NO_DEMAND, IntWidth.U128),
            parsed.numericBound
        );
        assertFalse(
            NumLiterals.finishParsingNum("170141183460469231731687303715884105727")
                .intValue.isU128()
        );
        assertThrows(IllegalStateException.class, () -> parsed.intValue.negate());
    }

    @Test
    @DisplayName("Values outside of the 128 bit range are rejected")
    void outOfRange() {
        assertEquals(
            MalformedLiteralException.Kind.OVERFLOW,
            failure(() -> NumLiterals.finishParsingNum(
                "340282366920938463463374607431768211456"
            ))
        );
        assertEquals(
            MalformedLiteralException.Kind.UNDERFLOW,
            failure(() -> NumLiterals.finishParsingNum(
                "-170141183460469231731687303715884105729"
            ))
        );
    }

    @Test
    @DisplayName("Missing or invalid digits are rejected")
    void invalidDigits() {
        assertEquals(
            MalformedLiteralException.Kind.EMPTY,
            failure(() -> NumLiterals.finishParsingNum("u8"))
        );
        assertEquals(
            MalformedLiteralException.Kind.EMPTY,
            failure(() -> NumLiterals.finishParsingNum("-"))
        );
        assertEquals(
            MalformedLiteralException.Kind.INVALID_DIGIT,
            failure(() -> NumLiterals.finishParsingNum("12x"))
        );
    }

    @Test
    @DisplayName("Hexadecimal digits are never read as a float suffix")
    void hexDigitsLookingLikeSuffix() throws MalformedLiteralException {
        NumLiterals.ParsedInt parsed = NumLiterals.finishParsingBase(
            "dec", Base.HEX, false
        );
        assertEquals(BigInteger.valueOf(0xdec), parsed.value().value());
        assertEquals(
            IntBound.atLeast(SignDemand.NO_DEMAND, IntWidth.I16), parsed.bound()
        );
    }

    @Test
    @DisplayName("The sign of a based literal only affects its bound")
    void negativeBasedLiterals() throws MalformedLiteralException {
        NumLiterals.ParsedInt parsed = NumLiterals.finishParsingBase(
            "ff", Base.HEX, true
        );
        assertEquals(BigInteger.valueOf(255), parsed.value().value());
        assertEquals(
            IntBound.atLeast(SignDemand.SIGNED, IntWidth.I16), parsed.bound()
        );
        assertEquals(
            IntBound.atLeast(SignDemand.SIGNED, IntWidth.I8),
            NumLiterals.finishParsingBase("80", Base.HEX, true).bound()
        );
        assertEquals(
            IntBound.exact(IntWidth.I16),
            NumLiterals.finishParsingBase("777i16", Base.OCTAL, true).bound()
        );
    }

    @ParameterizedTest
    @CsvSource({
        "80i8, I8",
        "8000i16, I16",
        "80000000i32, I32",
        "8000000000000000i64, I64"
    })
    @DisplayName("Negative based literals reach the minimum of their width")
    void negativeBasedMinimum(String raw, IntWidth width)
            throws MalformedLiteralException {
        NumLiterals.ParsedInt parsed = NumLiterals.finishParsingBase(
            raw, Base.HEX, true
        );
        assertEquals(IntBound.exact(width), parsed.bound());
        assertEquals(width.minValue().negate(), parsed.value().value());
    }

    @ParameterizedTest
    @CsvSource({
        "81i8", "8001i16", "80000001i32", "8000000000000001i64"
    })
    @DisplayName("Negative based literals below their width underflow")
    void negativeBasedBelowMinimum(String raw) {
        assertEquals(
            MalformedLiteralException.Kind.UNDERFLOW,
            failure(() -> NumLiterals.finishParsingBase(raw, Base.HEX, true))
        );
    }

    @Test
    @DisplayName("Positive based literals can not reach past their maximum")
    void positiveBasedMaximum() throws MalformedLiteralException {
        assertEquals(
            IntBound.exact(IntWidth.I8),
            NumLiterals.finishParsingBase("7fi8", Base.HEX, false).bound()
        );
        assertEquals(
            MalformedLiteralException.Kind.OVERFLOW,
            failure(() -> NumLiterals.finishParsingBase("80i8", Base.HEX, false))
        );
    }

    @Test
    @DisplayName("Based literals reject negative unsigned and float suffixes")
    void basedLiteralFailures() {
        assertEquals(
            MalformedLiteralException.Kind.UNDERFLOW,
            failure(() -> NumLiterals.finishParsingBase("ffu8", Base.HEX, true))
        );
        assertEquals(
            MalformedLiteralException.Kind.FLOAT_SUFFIX,
            failure(() -> NumLiterals.finishParsingBase(
                "1f64", Base.DECIMAL, false
            ))
        );
        assertEquals(
            MalformedLiteralException.Kind.INVALID_DIGIT,
            failure(() -> NumLiterals.finishParsingBase("102", Base.BINARY, false))
        );
    }

    @Test
    @DisplayName("Floats keep their text without the suffix")
    void floats() throws MalformedLiteralException {
        NumLiterals.ParsedFloat plain = NumLiterals.finishParsingFloat("1_000.5");
        assertEquals(1000.5, plain.value());
        assertEquals("1_000.5", plain.textWithoutSuffix());
        assertEquals(FloatBound.NONE, plain.bound());

        NumLiterals.ParsedFloat suffixed = NumLiterals.finishParsingFloat("2.5f32");
        assertEquals("2.5", suffixed.textWithoutSuffix());
        assertEquals(FloatBound.exact(FloatWidth.F32), suffixed.bound());

        assertEquals(
            -1.5e3, NumLiterals.finishParsingFloat("-1.5e3").value()
        );
    }

    @Test
    @DisplayName("Malformed floats are rejected")
    void floatFailures() {
        assertEquals(
            MalformedLiteralException.Kind.INT_SUFFIX,
            failure(() -> NumLiterals.finishParsingFloat("1.0u8"))
        );
        assertEquals(
            MalformedLiteralException.Kind.INVALID_DIGIT,
            failure(() -> NumLiterals.finishParsingFloat("1.2.3"))
        );
        assertEquals(
            MalformedLiteralException.Kind.INVALID_DIGIT,
            failure(() -> NumLiterals.finishParsingFloat("1.2x"))
        );
        assertEquals(
            MalformedLiteralException.Kind.NOT_FINITE,
            failure(() -> NumLiterals.finishParsingFloat("1e400"))
        );
        assertEquals(
            MalformedLiteralException.Kind.NOT_FINITE,
            failure(() -> NumLiterals.finishParsingFloat("1e39f32"))
        );
    }

    @Test
    @DisplayName("Integer widths know their ranges")
    void widthRanges() {
        assertTrue(IntWidth.I8.fits(BigInteger.valueOf(-128)));
        assertFalse(IntWidth.I8.fits(BigInteger.valueOf(128)));
        assertEquals(
            BigInteger.TWO.pow(64).subtract(BigInteger.ONE),
            IntWidth.U64.maxValue()
        );
        assertEquals(BigInteger.ZERO, IntWidth.NAT.minValue());
    }

}
