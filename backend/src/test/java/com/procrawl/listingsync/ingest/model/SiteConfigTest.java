package com.procrawl.listingsync.ingest.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SiteConfigTest {

    @Test
    void originIsReducedToSchemeAndHost() {
        SiteConfig config = SiteConfig.of("apolar", "HTTPS://WWW.Apolar.com.br/imoveis/alugar");

        assertThat(config.siteOrigin()).isEqualTo("https://www.apolar.com.br");
        assertThat(config.baseUrl()).isEqualTo("https://www.apolar.com.br");
        assertThat(config.enabled()).isTrue();
        assertThat(config.fieldMapping()).isEqualTo(FieldMapping.defaults());
    }

    @Test
    void explicitPortIsKeptInOrigin() {
        assertThat(SiteConfig.of("local", "http://localhost:8081/").siteOrigin()).isEqualTo("http://localhost:8081");
    }

    @Test
    void baseUrlOverrideWins() {
        SiteConfig config = SiteConfig.builder("apolar", "https://www.apolar.com.br")
            .baseUrlOverride("https://www.apolar.com.br/imoveis/")
            .build();

        assertThat(config.baseUrl()).isEqualTo("https://www.apolar.com.br/imoveis/");
        assertThat(config.baseUrlOverride()).isEqualTo("https://www.apolar.com.br/imoveis/");
    }

    @Test
    void trackingParametersAreLowerCasedAndMerged() {
        SiteConfig config = SiteConfig.builder("apolar", "https://www.apolar.com.br")
            .trackingParameters(List.of("UTM_Source", " gclid "))
            .trackingParameters(List.of("ref", "utm_source"))
            .build();

        assertThat(config.trackingParameters()).containsExactly("utm_source", "gclid", "ref");
    }

    @Test
    void rejectsMissingOrNonHttpOrigin() {
        assertThatThrownBy(() -> SiteConfig.of("apolar", null)).isInstanceOf(InvalidSiteConfigException.class);
        assertThatThrownBy(() -> SiteConfig.of("apolar", "ftp://www.apolar.com.br"))
            .isInstanceOf(InvalidSiteConfigException.class);
        assertThatThrownBy(() -> SiteConfig.of("apolar", "www.apolar.com.br"))
            .isInstanceOf(InvalidSiteConfigException.class);
    }

    @Test
    void rejectsBlankName() {
        assertThatThrownBy(() -> SiteConfig.of(" ", "https://www.apolar.com.br"))
            .isInstanceOf(InvalidSiteConfigException.class);
    }

    @Test
    void rejectsRelativeBaseUrlOverride() {
        assertThatThrownBy(() -> SiteConfig.builder("apolar", "https://www.apolar.com.br")
            .baseUrlOverride("/imoveis")
            .build())
            .isInstanceOf(InvalidSiteConfigException.class);
    }

    @Test
    void primaryUrlFieldCannotAlsoBeSecondary() {
        assertThatThrownBy(() -> new FieldMapping("link", Set.of("link"), Map.of(), Set.of(), Set.of()))
            .isInstanceOf(InvalidSiteConfigException.class);
    }

    @Test
    void fieldMappingFallsBackToDefaultPrimaryField() {
        FieldMapping mapping = new FieldMapping(" ", null, null, null, null);

        assertThat(mapping.primaryUrlField()).isEqualTo("property_url");
        assertThat(mapping.secondaryUrlFields()).isEmpty();
        assertThat(mapping.numericFormat("rent_price_brl")).isNull();
    }
}
