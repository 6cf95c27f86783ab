package io.elementschema.core.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.elementschema.core.element.BooleanElement;
import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementType;
import io.elementschema.core.element.FloatElement;
import io.elementschema.core.element.IntegerElement;
import io.elementschema.core.element.Sentinel;
import io.elementschema.core.element.UnicodeElement;
import io.elementschema.core.error.ElementSchemaException.Operation;
import io.elementschema.core.error.InvalidArgumentException;
import io.elementschema.core.mapping.Dict;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Behaviour of each validator in the library, including its message. */
class ValidatorLibraryTest {

    private static Element<?> check(ElementType<?> type, Object raw, Validator validator) {
        Element<?> element = type.validatedBy(validator).create(raw);
        element.validate();
        return element;
    }

    private static Element<?> text(String raw, Validator validator) {
        return check(UnicodeElement.TYPE, raw, validator);
    }

    private static Element<?> number(Object raw, Validator validator) {
        return check(IntegerElement.TYPE, raw, validator);
    }

    // ── Presence and conversion ──

    @Test
    void presentRejectsOnlyMissingInput() {
        assertThat(UnicodeElement.TYPE.validatedBy(new Present()).create().validate()).isFalse();
        assertThat(text("", new Present()).isValid()).isTrue();
        assertThat(number("x", new Present()).isValid()).isTrue();
        assertThat(check(UnicodeElement.TYPE, Sentinel.UNSPECIFIED, new Present()).errors())
                .containsExactly("May not be blank.");
    }

    @Test
    void convertedRejectsSentinels() {
        assertThat(number("x", new Converted()).errors()).containsExactly("Not a valid value.");
        assertThat(IntegerElement.TYPE.validatedBy(new Converted()).create().validate()).isFalse();
        assertThat(number("12", new Converted()).isValid()).isTrue();
    }

    @Test
    void isTrueAndIsFalseFollowTruthiness() {
        assertThat(check(BooleanElement.TYPE, true, new IsTrue()).isValid()).isTrue();
        assertThat(check(BooleanElement.TYPE, "false", new IsTrue()).errors()).containsExactly("Must be true.");
        assertThat(check(BooleanElement.TYPE, false, new IsFalse()).isValid()).isTrue();
        assertThat(text("", new IsFalse()).isValid()).isTrue();
        assertThat(number(3, new IsFalse()).errors()).containsExactly("Must be false.");
        assertThat(BooleanElement.TYPE.validatedBy(new IsFalse()).create().validate()).isFalse();
    }

    // ── Length ──

    @Test
    @DisplayName("ShorterThan(5): 4 characters pass, 5 fail")
    void shorterThanIsStrict() {
        assertThat(text("abcd", new ShorterThan(5)).isValid()).isTrue();
        assertThat(text("abcde", new ShorterThan(5)).errors()).containsExactly("Must be shorter than 5.");
    }

    @Test
    void longerThanIsStrict() {
        assertThat(text("abc", new LongerThan(2)).isValid()).isTrue();
        assertThat(text("ab", new LongerThan(2)).errors()).containsExactly("Must be longer than 2.");
    }

    @Test
    void lengthCountsCodePoints() {
        assertThat(text("😀😀", new ShorterThan(3)).isValid()).isTrue();
    }

    @Test
    void lengthWithinRangeExcludesBothEnds() {
        LengthWithinRange range = new LengthWithinRange(1, 4);

        assertThat(text("a", range).errors()).containsExactly("Must be longer than 1 and shorter than 4.");
        assertThat(text("ab", range).isValid()).isTrue();
        assertThat(text("abc", range).isValid()).isTrue();
        assertThat(text("abcd", range).isValid()).isFalse();
    }

    @Test
    void lengthOfMissingInputFailsWithMessage() {
        Element<?> element = UnicodeElement.TYPE.validatedBy(new ShorterThan(5)).create();

        assertThat(element.validate()).isFalse();
        assertThat(element.errors()).containsExactly("Must be shorter than 5.");
    }

    @Test
    void lengthOfAValueWithoutLengthIsASchemaError() {
        Element<?> element = IntegerElement.TYPE.validatedBy(new ShorterThan(5)).create(3);

        assertThatThrownBy(element::validate)
                .isInstanceOf(InvalidArgumentException.class)
                .satisfies(e -> assertThat(((InvalidArgumentException) e).operation()).isEqualTo(Operation.VALIDATE));
    }

    // ── Membership and ordering ──

    @Test
    void containedInChecksTheCoercedValue() {
        ContainedIn options = new ContainedIn(List.of(1L, 2L, 3L));

        assertThat(number("2", options).isValid()).isTrue();
        assertThat(number(4, options).errors()).containsExactly("Not a valid value.");
        assertThat(IntegerElement.TYPE.validatedBy(options).create().validate()).isFalse();
    }

    @Test
    void containedInMatchesNumbersAcrossTypes() {
        ContainedIn options = new ContainedIn(List.of(1, 2, 3));

        assertThat(number("2", options).isValid()).isTrue();
        assertThat(number(3, options).isValid()).isTrue();
        assertThat(number(4, options).errors()).containsExactly("Not a valid value.");
        assertThat(check(FloatElement.TYPE, 2.0, options).isValid()).isTrue();
        assertThat(check(FloatElement.TYPE, 2.5, options).isValid()).isFalse();
    }

    @Test
    void containedInKeepsTextAndNumbersApart() {
        assertThat(text("2", new ContainedIn(List.of(1, 2, 3))).isValid()).isFalse();
        assertThat(number(2, new ContainedIn(List.of("2"))).isValid()).isFalse();
    }

    @Test
    void containedInAcceptsNullOptions() {
        List<Object> options = new ArrayList<>(new ContainedIn(Arrays.asList("a", null)).options());

        assertThat(options).containsExactly("a", null);
        assertThat(text("a", new ContainedIn(Arrays.asList("a", null))).isValid()).isTrue();
    }

    @Test
    void lessThanAndGreaterThanAreStrict() {
        assertThat(number(9, new LessThan(10)).isValid()).isTrue();
        assertThat(number(10, new LessThan(10)).errors()).containsExactly("Must be less than 10.");
        assertThat(number(1, new GreaterThan(0)).isValid()).isTrue();
        assertThat(number(0, new GreaterThan(0)).errors()).containsExactly("Must be greater than 0.");
    }

    @Test
    void comparisonsMixNumberTypes() {
        assertThat(number(3, new LessThan(3.5)).isValid()).isTrue();
        assertThat(check(FloatElement.TYPE, 2.5, new GreaterThan(2)).isValid()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 5, 9})
    void withinRangeAcceptsInterior(int value) {
        assertThat(number(value, new WithinRange(0, 10)).isValid()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 10, -1, 11})
    void withinRangeRejectsBoundsAndOutside(int value) {
        assertThat(number(value, new WithinRange(0, 10)).errors())
                .containsExactly("Must be greater than 0 and shorter than 10.");
    }

    @Test
    void incomparableBoundIsASchemaError() {
        Element<?> element = IntegerElement.TYPE.validatedBy(new LessThan("ten")).create(3);

        assertThatThrownBy(element::validate).isInstanceOf(InvalidArgumentException.class);
    }

    // ── Equality ──

    @Test
    void itemsEqualComparesMapEntries() {
        ElementType<Dict<String, Long>> pair = Dict.of(UnicodeElement.TYPE, IntegerElement.TYPE);
        ItemsEqual same = new ItemsEqual(Operand.of("A", "a"), Operand.of("B", "b"));

        assertThat(check(pair, Map.of("a", 1, "b", "1"), same).isValid()).isTrue();
        assertThat(check(pair, Map.of("a", 1, "b", 2), same).errors()).containsExactly("A and B must be equal.");
        assertThat(check(pair, Map.of("a", 1), same).isValid()).isFalse();
        assertThat(check(pair, Map.of("a", "x", "b", "x"), same).isValid()).isFalse();
    }

    @Test
    void attributesEqualComparesChildValues() {
        ElementType<Dict<String, Long>> pair = Dict.of(UnicodeElement.TYPE, IntegerElement.TYPE);
        AttributesEqual same = new AttributesEqual(Operand.of("A", "a"), Operand.of("B", "b"));

        assertThat(check(pair, Map.of("a", "7", "b", 7), same).isValid()).isTrue();
        assertThat(check(pair, Map.of("a", 7, "b", 8), same).errors()).containsExactly("A and B must be equal.");
    }

    @Test
    void attributesEqualNeedsNamedChildren() {
        Element<?> scalar = UnicodeElement.TYPE
                .validatedBy(new AttributesEqual(Operand.of("A", "a"), Operand.of("B", "b")))
                .create("x");
        Element<?> missing = Dict.of(UnicodeElement.TYPE, IntegerElement.TYPE)
                .validatedBy(new AttributesEqual(Operand.of("A", "a"), Operand.of("B", "b")))
                .create(Map.of("a", 1));

        assertThatThrownBy(scalar::validate).isInstanceOf(InvalidArgumentException.class);
        assertThatThrownBy(missing::validate)
                .isInstanceOf(InvalidArgumentException.class)
                .hasMessageContaining("no child named 'b'");
    }

    // ── Text formats ──

    @Test
    void matchesRegexAnchorsAtTheStartOnly() {
        MatchesRegex letters = new MatchesRegex("[a-z]+");

        assertThat(text("abc1", letters).isValid()).isTrue();
        assertThat(text("1abc", letters).errors()).containsExactly("Must be a valid value.");
        assertThat(text("", new MatchesRegex()).isValid()).isTrue();
    }

    @Test
    void matchesRegexUsesCustomMessage() {
        MatchesRegex digits = new MatchesRegex(Pattern.compile("\\d+$"), "Digits only.");

        assertThat(text("12a", digits).errors()).containsExactly("Digits only.");
    }

    @ParameterizedTest
    @ValueSource(strings = {"https://example.com", "http://localhost:8080/path?q=1", "ftp://files.example.org/a"})
    void isUrlAcceptsAbsoluteUrls(String url) {
        assertThat(text(url, new IsUrl()).isValid()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"example.com", "/relative/path", "http://", "not a url", "mailto:someone"})
    void isUrlRejectsEverythingElse(String url) {
        assertThat(text(url, new IsUrl()).errors()).containsExactly("Must be a URL.");
    }

    @ParameterizedTest
    @ValueSource(strings = {"jane@example.com", "a@b.c", "first.last@sub.domain.org"})
    void emailNeedsADotAfterTheAt(String address) {
        assertThat(text(address, new ProbablyAnEmailAddress()).isValid()).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"jane", "jane@localhost", "jane.doe.example.com"})
    void emailWithoutDottedHostFails(String address) {
        assertThat(text(address, new ProbablyAnEmailAddress()).errors())
                .containsExactly("Must be a valid e-mail address.");
    }
}
