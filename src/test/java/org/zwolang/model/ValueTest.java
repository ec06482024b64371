package org.zwolang.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.LinkedHashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueTest {

    @ParameterizedTest
    @CsvSource({
        "65, 0.650",
        "100, 1.000",
        "5, 0.050",
        "125, 1.250",
    })
    void percentage_formatsAsThreeDecimalFraction(int percent, String expected) {
        assertThat(new Value.Percentage(percent).format()).isEqualTo(expected);
    }

    @Test
    void powerZone_formatsAsItsPercentage() {
        assertThat(PowerZone.Z1.format()).isEqualTo("0.500");
        assertThat(PowerZone.SS.format()).isEqualTo("0.900");
        assertThat(PowerZone.Z7.percentage()).isEqualTo(new Value.Percentage(150));
    }

    @Test
    void powerZone_lookupByName() {
        assertThat(PowerZone.fromName("Z3").get()).isEqualTo(PowerZone.Z3);
        assertThat(PowerZone.fromName("Z8").isEmpty()).isTrue();
        assertThat(PowerZone.fromName("z1").isEmpty()).isTrue();
    }

    @ParameterizedTest
    @CsvSource({
        "11, 6, 666",
        "0, 30, 30",
        "1, 90, 150",
    })
    void duration_convertsMinutesAndSecondsToSeconds(int minutes, int seconds, String expected) {
        var duration = Value.Duration.of(minutes, seconds);

        assertThat(duration.format()).isEqualTo(expected);
        assertThat(duration.seconds()).isEqualTo(Integer.parseInt(expected));
    }

    @Test
    void range_formatsBothEndpoints() {
        var range = new Value.Range(new Value.Percentage(65), PowerZone.Z4);

        assertThat(range.format()).isEqualTo("0.650 -> 0.950");
    }

    @Test
    void relativePower_coversPercentagesAndZones() {
        assertThat(Value.isRelativePower(new Value.Percentage(50))).isTrue();
        assertThat(Value.isRelativePower(PowerZone.Z2)).isTrue();
        assertThat(Value.isRelativePower(new Value.Number(200))).isFalse();
        assertThat(Value.isRelativePower(new Value.Duration(30))).isFalse();
    }

    @Test
    void tag_keywordLookupIsCaseSensitiveAndExcludesMessages() {
        assertThat(Tag.fromKeyword("START_REPEAT").get()).isEqualTo(Tag.START_REPEAT);
        assertThat(Tag.fromKeyword("free").isEmpty()).isTrue();
        assertThat(Tag.fromKeyword("MESSAGES").isEmpty()).isTrue();
    }

    @Test
    void tag_classifiesKinds() {
        assertThat(Tag.WARMUP.isRampLike()).isTrue();
        assertThat(Tag.SEGMENT.isRampLike()).isFalse();
        assertThat(Tag.END_REPEAT.isBlockKind()).isTrue();
        assertThat(Tag.POWER.isBlockKind()).isFalse();
        assertThat(Tag.DESCRIPTION.elementName()).isEqualTo("description");
    }

    @Test
    void block_keepsParameterOrderAndIsImmutable() {
        var params = new LinkedHashMap<Tag, Value>();
        params.put(Tag.POWER, new Value.Percentage(65));
        params.put(Tag.DURATION, new Value.Duration(30));
        var block = Block.block(Tag.SEGMENT, params);
        params.clear();

        assertThat(block.params().keySet()).containsExactly(Tag.POWER, Tag.DURATION);
        assertThat(block.param(Tag.DURATION).get()).isEqualTo(new Value.Duration(30));
        assertThat(block.has(Tag.CADENCE)).isFalse();
        assertThatThrownBy(() -> block.params().put(Tag.CADENCE, new Value.Number(90)))
            .isInstanceOf(UnsupportedOperationException.class);
    }
}
