package json.sane;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SaneTest extends SaneTestBase {

    @Test
    void wrapPicksTheFacadeByShape() {
        assertThat(Sane.wrap(map("a", 1))).isInstanceOf(JsonDict.class);
        assertThat(Sane.wrap(list(1))).isInstanceOf(JsonList.class);
    }

    @Test
    void wrapReturnsFacadesUnchanged() {
        final var dict = new JsonDict();
        assertThat(Sane.wrap(dict)).isSameAs(dict);
    }

    @Test
    void wrapValidatesUnlessTold() {
        final var raw = list(1, new Object());
        assertThatThrownBy(() -> Sane.wrap(raw))
                .isInstanceOf(InvalidValueException.class)
                .satisfies(e -> assertThat(((InvalidValueException) e).path()).isEqualTo(KeyPath.of(1)));
        assertThat(Sane.wrap(raw, false).unwrap()).isSameAs(raw);
    }

    @Test
    void onlyContainersCanBeWrapped() {
        assertThatThrownBy(() -> Sane.wrap("text"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("cannot wrap str: \"text\"");
        assertThatThrownBy(() -> Sane.wrap(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unwrapIfWrapped() {
        final var raw = map("a", 1);
        assertThat(Sane.unwrapIfWrapped(JsonDict.wrap(raw))).isSameAs(raw);
        assertThat(Sane.unwrapIfWrapped("a")).isEqualTo("a");
        assertThat(Sane.unwrapIfWrapped(null)).isNull();
    }

    @Test
    void aliasedFacadesSeeEachOthersWrites() {
        final var raw = map("a", map());
        final var first = (JsonDict) Sane.wrap(raw);
        final var second = (JsonDict) Sane.wrap(raw);
        first.set(List.of("a", "b"), 1);
        assertThat(second.get(List.of("a", "b"))).isEqualTo(1);
        assertThat(raw).isEqualTo(map("a", map("b", 1)));
    }
}
