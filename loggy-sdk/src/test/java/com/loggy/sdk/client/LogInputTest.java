package com.loggy.sdk.client;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class LogInputTest {

    @Test
    void classifiesPlainValues() {
        assertThat(LogInput.of("text").getKind()).isEqualTo(LogInput.Kind.TEXT);
        assertThat(LogInput.of(42).getKind()).isEqualTo(LogInput.Kind.TEXT);
        assertThat(LogInput.of(null).getKind()).isEqualTo(LogInput.Kind.TEXT);
        assertThat(LogInput.of(Map.of("a", 1)).getKind()).isEqualTo(LogInput.Kind.OBJECT);
        assertThat(LogInput.of(List.of("a")).getKind()).isEqualTo(LogInput.Kind.BATCH);
        assertThat(LogInput.of(Set.of("a")).getKind()).isEqualTo(LogInput.Kind.BATCH);
        assertThat(LogInput.of(new RuntimeException()).getKind()).isEqualTo(LogInput.Kind.ERROR);
    }

    @Test
    void alreadyClassifiedInputIsReturnedAsIs() {
        LogInput input = LogInput.text("x");

        assertThat(LogInput.of(input)).isSameAs(input);
    }

    @Test
    void mapKeysAreStringified() {
        Map<Object, Object> raw = new HashMap<>();
        raw.put(7, "seven");

        assertThat(LogInput.of(raw).asObject()).containsExactly(entry("7", "seven"));
    }

    @Test
    void batchElementsAreClassifiedIndividually() {
        List<LogInput> elements = LogInput.of(List.of("a", Map.of("b", 2), new IllegalStateException("c"))).asBatch();

        assertThat(elements).extracting(LogInput::getKind)
                .containsExactly(LogInput.Kind.TEXT, LogInput.Kind.OBJECT, LogInput.Kind.ERROR);
    }

    @Test
    void throwableDetailsUseSimpleNameAndFullStack() {
        LogInput.ErrorDetails details = LogInput.error(new IllegalStateException("broken")).asError();

        assertThat(details.getName()).isEqualTo("IllegalStateException");
        assertThat(details.getMessage()).isEqualTo("broken");
        assertThat(details.getStack()).startsWith("java.lang.IllegalStateException: broken").contains("\tat ");
    }

    @Test
    void wrongAccessorFails() {
        assertThatThrownBy(() -> LogInput.text("x").asObject())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TEXT");
    }

    @Test
    void fieldsClassification() {
        assertThat(LogFields.of(null).getKind()).isEqualTo(LogFields.Kind.NONE);
        assertThat(LogFields.of(Map.of("a", 1)).getKind()).isEqualTo(LogFields.Kind.MAP);
        assertThat(LogFields.of(2.5).asNumber()).isEqualTo(2.5);
        assertThat(LogFields.of(true).asFlag()).isTrue();
        assertThat(LogFields.of("nope").getKind()).isEqualTo(LogFields.Kind.OTHER);
        assertThat(LogFields.of("nope").asMap()).isEmpty();
        assertThat(LogFields.none().asFlag()).isFalse();
    }

    @Test
    void objectAndFieldMapsAreDetachedCopies() {
        Map<String, Object> source = new HashMap<>();
        source.put("orderId", 7);
        LogInput input = LogInput.object(source);
        LogFields fields = LogFields.map(source);

        source.put("late", true);

        assertThat(input.asObject()).containsOnlyKeys("orderId");
        assertThat(fields.asMap()).containsOnlyKeys("orderId");
        assertThatThrownBy(() -> input.asObject().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> fields.asMap().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toStringShowsVariantPayload() {
        assertThat(LogInput.text("hi")).hasToString("LogInput{TEXT: hi}");
        assertThat(LogInput.batch(List.of("a"))).hasToString("LogInput{BATCH: [LogInput{TEXT: a}]}");
        assertThat(LogFields.number(3)).hasToString("LogFields{NUMBER: 3}");
        assertThat(LogFields.none()).hasToString("LogFields{NONE}");
    }
}
