package io.elementschema.core.mapping;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.elementschema.core.element.Element;
import io.elementschema.core.element.ElementType;
import io.elementschema.core.element.ElementValue;
import io.elementschema.core.element.IntegerElement;
import io.elementschema.core.element.PathedElement;
import io.elementschema.core.element.UnicodeElement;
import io.elementschema.core.error.EmptyMappingException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link OrderedDict}. */
class OrderedDictTest {

    private static final ElementType<OrderedDict<String, Long>> TYPE =
            OrderedDict.of(UnicodeElement.TYPE, IntegerElement.TYPE);

    private static OrderedDict<String, Long> abc() {
        OrderedDict<String, Long> dict = TYPE.create();
        dict.set("a", 1);
        dict.set("b", 2);
        dict.set("c", 3);
        return dict;
    }

    private static List<String> keys(OrderedDict<String, Long> dict) {
        return dict.keys().map(Element::value).map(ElementValue::get).toList();
    }

    @Test
    void valueKeepsInsertionOrder() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("z", 1);
        raw.put("a", 2);
        raw.put("m", 3);
        OrderedDict<String, Long> dict = TYPE.create(raw);

        assertThat(dict.value().get()).isInstanceOf(LinkedHashMap.class);
        assertThat(dict.value().get().keySet()).containsExactly("z", "a", "m");
    }

    @Test
    void reassigningKeepsPositionAndReinsertingMovesToEnd() {
        OrderedDict<String, Long> dict = abc();
        dict.set("a", 10);
        assertThat(keys(dict)).containsExactly("a", "b", "c");
        assertThat(dict.getItem("a")).isEqualTo(ElementValue.of(10L));

        dict.delete("a");
        dict.set("a", 1);
        assertThat(keys(dict)).containsExactly("b", "c", "a");
    }

    @Test
    void popItemTakesFromEitherEnd() {
        OrderedDict<String, Long> dict = abc();

        Item<String, Long> last = dict.popItem(true);
        Item<String, Long> first = dict.popItem(false);

        assertThat(last.key().value().get()).isEqualTo("c");
        assertThat(last.value()).isEqualTo(ElementValue.of(3L));
        assertThat(first.key().value().get()).isEqualTo("a");
        assertThat(keys(dict)).containsExactly("b");
    }

    @Test
    void popItemDefaultsToNewest() {
        OrderedDict<String, Long> dict = abc();

        assertThat(dict.popItem().key().value().get()).isEqualTo("c");
    }

    @Test
    void popItemOnEmptyFails() {
        OrderedDict<String, Long> dict = TYPE.create();

        assertThatThrownBy(() -> dict.popItem(false)).isInstanceOf(EmptyMappingException.class);
        assertThatThrownBy(dict::popItem).isInstanceOf(EmptyMappingException.class);
    }

    @Test
    void popItemRemovesEntryWhoseKeyElementWasReset() {
        OrderedDict<String, Long> dict = TYPE.create();
        dict.set("a", 1);
        dict.keys().findFirst().orElseThrow().set("b");

        Item<String, Long> item = dict.popItem();

        assertThat(item.key().value().get()).isEqualTo("b");
        assertThat(item.value()).isEqualTo(ElementValue.of(1L));
        assertThat(dict.isEmpty()).isTrue();
    }

    @Test
    void popItemFromTheFrontAfterKeyReset() {
        OrderedDict<String, Long> dict = abc();
        dict.keyElement("a").set("z");

        assertThat(dict.popItem(false).value()).isEqualTo(ElementValue.of(1L));
        assertThat(keys(dict)).containsExactly("b", "c");
    }

    @Test
    void popKeepsTheOrderOfTheRest() {
        OrderedDict<String, Long> dict = abc();

        assertThat(dict.pop("b")).isEqualTo(ElementValue.of(2L));
        assertThat(keys(dict)).containsExactly("a", "c");
        assertThat(dict.pop("b", "4")).isEqualTo(ElementValue.of(4L));
    }

    @Test
    void reversedKeysMirrorInsertionOrder() {
        OrderedDict<String, Long> dict = abc();

        assertThat(dict.reversedKeys().map(k -> k.value().get())).containsExactly("c", "b", "a");
    }

    @Test
    void traversalPathsFollowInsertionOrder() {
        OrderedDict<String, Long> dict = TYPE.create();
        dict.set("a", 1);
        dict.set("b", 2);

        List<PathedElement> leaves = dict.traverse().toList();

        assertThat(leaves).extracting(PathedElement::path)
                .containsExactly(List.of(0, 0), List.of(0, 1), List.of(1, 0), List.of(1, 1));
        assertThat(leaves).extracting(leaf -> (Object) leaf.element().value().get())
                .containsExactly("a", 1L, "b", 2L);
    }

    @Test
    void traversalIsLazy() {
        OrderedDict<String, Long> dict = abc();

        assertThat(dict.traverse().limit(1).toList()).hasSize(1);
    }

    @Test
    void unserializeKeepsSourceOrder() {
        ElementValue<Map<Object, Object>> result =
                OrderedDict.unserialize(List.of(List.of("y", 1), List.of("x", 2)));

        assertThat(result.get().keySet()).containsExactly("y", "x");
    }

    @Test
    void updateFollowsTheSourceOrder() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("q", 1);
        source.put("p", 2);
        OrderedDict<String, Long> dict = TYPE.create();
        dict.updateWith(new Object[] {source}, Map.of("r", 3));

        assertThat(keys(dict)).containsExactly("q", "p", "r");
    }
}
