package json.sane;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonListTest extends SaneTestBase {

    @Nested
    class Construction {

        @Test
        void wrapKeepsIdentityAndConstructorCopies() {
            final var raw = list(1, "two", map("three", 3));
            assertThat(JsonList.wrap(raw).unwrap()).isSameAs(raw);
            final var copy = new JsonList(raw);
            assertThat(copy.unwrap()).isNotSameAs(raw).isEqualTo(raw);
        }

        @Test
        void ofAcceptsNulls() {
            final var list = JsonList.of("a", null, 1);
            assertThat(list.size()).isEqualTo(3);
            assertThat(list.get(1)).isNull();
        }

        @Test
        void rejectsForeignValues() {
            assertThatThrownBy(() -> JsonList.of("ok", new StringBuilder("nope")))
                    .isInstanceOf(InvalidValueException.class)
                    .hasMessageContaining("StringBuilder")
                    .satisfies(e -> assertThat(((InvalidValueException) e).path()).isEqualTo(KeyPath.of(1)));
        }

        @Test
        void pathMustStartWithAnIndex() {
            assertThatThrownBy(() -> JsonList.of(1).get("a"))
                    .isInstanceOf(PathSyntaxException.class)
                    .hasMessageContaining("must start with an index");
        }
    }

    @Nested
    class Mutation {

        @Test
        void appendExtendInsert() {
            final var list = new JsonList();
            list.append(1);
            list.extend(List.of(2, 3));
            list.insert(0, 0);
            list.insert(-1, 2.5);
            list.insert(list.size(), 4);
            assertThat(list.unwrap()).containsExactly(0, 1, 2, 2.5, 3, 4);
        }

        @Test
        void insertOutOfRange() {
            final var list = JsonList.of(1);
            assertThatThrownBy(() -> list.insert(3, 2)).isInstanceOf(IndexNotFoundException.class);
            assertThatThrownBy(() -> list.insert(-2, 2)).isInstanceOf(IndexNotFoundException.class);
        }

        @Test
        void typedAppendAndExtend() {
            final var list = new JsonList();
            list.append("a", String.class);
            assertThatThrownBy(() -> list.append(1, String.class))
                    .isInstanceOf(InvalidValueException.class)
                    .hasMessage("expected str, got int at path [1]: 1");
            assertThatThrownBy(() -> list.extend(List.of("b", 2), String.class))
                    .isInstanceOf(InvalidValueException.class)
                    .satisfies(e -> assertThat(((InvalidValueException) e).path()).isEqualTo(KeyPath.of(2)));
            assertThat(list.unwrap()).containsExactly("a");
        }

        @Test
        void extendWithItself() {
            final var list = JsonList.of(1, 2);
            list.extend(list);
            assertThat(list.unwrap()).containsExactly(1, 2, 1, 2);
        }

        @Test
        void setByNegativeIndex() {
            final var list = JsonList.of("a", "b");
            list.set(-1, "z");
            assertThat(list.unwrap()).containsExactly("a", "z");
            assertThatThrownBy(() -> list.set(2, "c")).isInstanceOf(IndexNotFoundException.class);
        }

        @Test
        void nestedWriteThroughAnElement() {
            final var list = JsonList.of(map("name", "a"));
            list.set(List.of(0, "tags", "primary"), "x");
            assertThat(list.get(List.of(0, "tags", "primary"))).isEqualTo("x");
        }
    }

    @Nested
    class Removal {

        @Test
        void popFromTheEndOrAnIndex() {
            final var list = JsonList.of(1, list(2), 3);
            assertThat(list.pop()).isEqualTo(3);
            assertThat(list.pop(-1)).isEqualTo(JsonList.of(2));
            assertThat(list.pop(0)).isEqualTo(1);
            assertThatThrownBy(list::pop)
                    .isInstanceOf(IndexNotFoundException.class)
                    .hasMessage("pop from empty list");
        }

        @Test
        void popNested() {
            final var list = JsonList.of(map("ids", list(1, 2, 3)));
            assertThat(list.pop(List.of(0, "ids", 1), Long.class)).isEqualTo(2);
            assertThat(list.get(List.of(0, "ids"))).isEqualTo(JsonList.of(1, 3));
            assertThatThrownBy(() -> list.pop(List.of(0, "ids"))).isInstanceOf(PathSyntaxException.class);
        }

        @Test
        void removeFirstOccurrence() {
            final var list = JsonList.of("a", "b", "a");
            assertThat(list.remove("a")).isTrue();
            assertThat(list.unwrap()).containsExactly("b", "a");
            assertThat(list.remove("zzz")).isFalse();
        }

        @Test
        void deleteAndClear() {
            final var list = JsonList.of(1, 2, 3);
            list.delete(1);
            assertThat(list.unwrap()).containsExactly(1, 3);
            list.clear();
            assertThat(list.isEmpty()).isTrue();
        }
    }

    @Nested
    class Searching {

        @Test
        void containsIndexOfCount() {
            final var list = JsonList.of(1, "1", map("a", 1), 1L);
            assertThat(list.contains("1")).isTrue();
            assertThat(list.contains(map("a", 1L))).isTrue();
            assertThat(list.contains(JsonDict.wrap(map("a", 1)))).isTrue();
            assertThat(list.contains(1.0)).isFalse();
            assertThat(list.indexOf(1L)).isEqualTo(0);
            assertThat(list.indexOf("x")).isEqualTo(-1);
            assertThat(list.count(1)).isEqualTo(2);
        }

        @Test
        void containsRejectsForeignValuesUnlessTyped() {
            final var list = JsonList.of(1);
            assertThatThrownBy(() -> list.contains(new Object())).isInstanceOf(InvalidValueException.class);
            assertThat(list.contains(new Object(), JsonKind.INT)).isFalse();
            assertThat(list.contains("1", JsonKind.INT)).isFalse();
            assertThat(list.contains(1, JsonKind.INT)).isTrue();
        }

        @Test
        void nullTypeBehavesLikeTheUntypedForm() {
            final var list = JsonList.of(1, "x", list(2));
            assertThat(list.contains("x", null)).isTrue();
            assertThat(list.contains("y", null)).isFalse();
            assertThat(list.get(2, null)).isInstanceOf(JsonList.class);
            assertThat(list.containsPath(List.of(2, 0), null)).isTrue();
            list.set(0, "one", null);
            list.delete(1, null);
            assertThat(list.unwrap()).containsExactly("one", List.of(2));
        }

        @Test
        void indexOfWithinBounds() {
            final var list = JsonList.of("a", "b", "a", "b", "a");
            assertThat(list.indexOf("a", 1, 5)).isEqualTo(2);
            assertThat(list.indexOf("a", 3, 4)).isEqualTo(-1);
            assertThat(list.indexOf("b", -2, 100)).isEqualTo(3);
            assertThat(list.indexOf("a", 4, 1)).isEqualTo(-1);
            assertThat(list.indexOf("a", -100, 1)).isEqualTo(0);
            assertThat(list.indexOf(1, 0, 5, JsonKind.INT)).isEqualTo(-1);
        }
    }

    @Nested
    class SliceAssignment {

        @Test
        void replacesARangeWithMoreOrFewerValues() {
            final var list = JsonList.of(0, 1, 2, 3, 4);
            list.setSlice(1, 3, List.of("x", "y", "z"));
            assertThat(list.unwrap()).containsExactly(0, "x", "y", "z", 3, 4);
            list.setSlice(-2, 100, List.of());
            assertThat(list.unwrap()).containsExactly(0, "x", "y", "z");
        }

        @Test
        void emptyRangeInsertsAtTheStart() {
            final var list = JsonList.of(0, 1, 2);
            list.setSlice(2, 0, List.of("in"));
            assertThat(list.unwrap()).containsExactly(0, 1, "in", 2);
        }

        @Test
        void acceptsItsOwnValues() {
            final var list = JsonList.of(1, map("a", 1));
            list.setSlice(0, 0, list);
            assertThat(list.unwrap()).containsExactly(1, map("a", 1), 1, map("a", 1));
        }

        @Test
        void failedAssignmentLeavesTheListUnchanged() {
            final var list = JsonList.of(0, 1, 2);
            assertThatThrownBy(() -> list.setSlice(0, 2, List.of(5, "six"), JsonKind.INT))
                    .isInstanceOf(InvalidValueException.class)
                    .hasMessageContaining("at path [1]");
            assertThatThrownBy(() -> list.setSlice(0, 2, List.of(new Object())))
                    .isInstanceOf(InvalidValueException.class);
            assertThat(list.unwrap()).containsExactly(0, 1, 2);
        }

        @Test
        void deleteSliceClamps() {
            final var list = JsonList.of(0, 1, 2, 3, 4);
            list.deleteSlice(1, 3);
            assertThat(list.unwrap()).containsExactly(0, 3, 4);
            list.deleteSlice(2, 1);
            list.deleteSlice(10, 20);
            assertThat(list.unwrap()).containsExactly(0, 3, 4);
            list.deleteSlice(-2, 100);
            assertThat(list.unwrap()).containsExactly(0);
        }

        @Test
        void repeatBuildsANewList() {
            final var list = JsonList.of(1, map("a", 1));
            final var tripled = list.repeat(3);
            assertThat(tripled.size()).isEqualTo(6);
            assertThat(tripled.unwrap()).containsExactly(1, map("a", 1), 1, map("a", 1), 1, map("a", 1));
            assertThat(list.size()).isEqualTo(2);
            assertThat(list.repeat(0).isEmpty()).isTrue();
            assertThat(list.repeat(-1).isEmpty()).isTrue();
        }
    }

    @Nested
    class Views {

        @Test
        void iterationWrapsContainers() {
            final var list = JsonList.of(map("a", 1), list(2), "x");
            final List<Object> seen = new ArrayList<>();
            list.forEach(seen::add);
            assertThat(seen.get(0)).isInstanceOf(JsonDict.class);
            assertThat(seen.get(1)).isInstanceOf(JsonList.class);
            assertThat(seen.get(2)).isEqualTo("x");
        }

        @Test
        void typedIterationNamesTheOffendingIndex() {
            final var list = JsonList.of(map("id", 1), map("id", 2), "three");
            final List<Object> seen = new ArrayList<>();
            assertThatThrownBy(() -> {
                for (Object label : list.iter(JsonKind.OBJECT)) {
                    seen.add(label);
                }
            }).isInstanceOf(InvalidValueException.class)
                    .hasMessageContaining("at path [2]");
            assertThat(seen).hasSize(2);
        }

        @Test
        void reversedAndReverse() {
            final var list = JsonList.of(1, 2, 3);
            assertThat(list.reversed()).containsExactly(3, 2, 1);
            list.reverse();
            assertThat(list.unwrap()).containsExactly(3, 2, 1);
        }

        @Test
        void sliceClampsAndCopies() {
            final var list = JsonList.of(0, 1, 2, 3, 4);
            assertThat(list.slice(1, 3).unwrap()).containsExactly(1, 2);
            assertThat(list.slice(-2, 100).unwrap()).containsExactly(3, 4);
            assertThat(list.slice(4, 1).isEmpty()).isTrue();
            final var slice = list.slice(0, 5);
            slice.append(5);
            assertThat(list.size()).isEqualTo(5);
        }

        @Test
        void concat() {
            final var joined = JsonList.of(1).concat(List.of("a"));
            assertThat((Object) joined).isEqualTo(JsonList.of(1, "a"));
        }
    }

    @Nested
    class Ordering {

        @Test
        void sortUsesNaturalOrder() {
            final var list = JsonList.of(3, 1.5, 2, -1L);
            list.sort();
            assertThat(list.unwrap()).containsExactly(-1L, 1.5, 2, 3);
        }

        @Test
        void sortWithComparator() {
            final var list = JsonList.of("bb", "a", "ccc");
            list.sort(Comparator.comparing(value -> ((String) value).length()));
            assertThat(list.unwrap()).containsExactly("a", "bb", "ccc");
        }

        @Test
        void mixedKindsCannotBeSorted() {
            final var list = JsonList.of(1, "a");
            assertThatThrownBy(list::sort).isInstanceOf(ClassCastException.class);
        }

        @Test
        void listsCompareLexicographically() {
            assertThat(JsonList.of(1, 2).compareTo(JsonList.of(1, 3))).isNegative();
            assertThat(JsonList.of(1, 2).compareTo(JsonList.of(1))).isPositive();
            assertThat(JsonList.of("a").compareTo(JsonList.of("a"))).isZero();
        }
    }

    @Test
    void equalityAndCopies() {
        final var raw = list(map("a", 1), 2);
        final var wrapped = JsonList.wrap(raw);
        final var deep = wrapped.deepCopy();
        assertThat((Object) wrapped).isEqualTo(deep).isNotEqualTo(JsonDict.wrap(map("a", 1)));
        wrapped.set(List.of(0, "a"), 9);
        assertThat(deep.get(List.of(0, "a"))).isEqualTo(1);
        assertThat(wrapped.copy().get(List.of(0, "a"))).isEqualTo(9);
        assertThat((Object) wrapped).hasToString("JsonList[{\"a\":9},2]");
    }

    @Test
    void checkTypesOnEveryElement() {
        final var list = JsonList.of("a", "b", null);
        list.checkTypes(TypeSpec.of(JsonKind.STRING, JsonKind.NULL));
        assertThatThrownBy(() -> list.checkTypes(String.class))
                .isInstanceOf(InvalidValueException.class)
                .hasMessage("expected str, got null at path [2]: null");
    }
}
