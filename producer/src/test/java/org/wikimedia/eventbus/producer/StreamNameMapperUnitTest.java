package org.wikimedia.eventbus.producer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.Test;

import com.google.common.collect.ImmutableMap;

public class StreamNameMapperUnitTest {

    @Test
    public void mapsConfiguredNames() {
        StreamNameMapper mapper = new StreamNameMapper(ImmutableMap.of(
                "mediawiki.page_change.v1", "rc0.mediawiki.page_change.v1"));

        assertThat(mapper.resolve("mediawiki.page_change.v1")).isEqualTo("rc0.mediawiki.page_change.v1");
        assertThat(mapper.resolve("mediawiki.page-delete")).isEqualTo("mediawiki.page-delete");
    }

    @Test
    public void emptyMapKeepsNames() {
        assertThat(new StreamNameMapper(ImmutableMap.of()).resolve("s")).isEqualTo("s");
    }
}
