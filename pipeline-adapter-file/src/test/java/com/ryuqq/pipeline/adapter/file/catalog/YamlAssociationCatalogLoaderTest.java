package com.ryuqq.pipeline.adapter.file.catalog;

import com.ryuqq.pipeline.application.catalog.AssociationCatalog;
import com.ryuqq.pipeline.application.catalog.AssociationSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class YamlAssociationCatalogLoaderTest {

    private final YamlAssociationCatalogLoader loader = new YamlAssociationCatalogLoader();

    @Test
    void 설정_파일의_순서대로_단체를_로드() throws IOException {
        // given
        try (InputStream in = getClass().getResourceAsStream("/associations.yml")) {

            // when
            AssociationCatalog catalog = loader.load(in);

            // then
            assertThat(catalog.codes()).containsExactly("PMA", "NEMA", "AGMA");
            assertThat(catalog.highPriorityCodes()).containsExactly("PMA");

            AssociationSource pma = catalog.find("PMA").orElseThrow();
            assertThat(pma.name()).isEqualTo("Precision Metalforming Association");
            assertThat(pma.directoryUrl()).isEqualTo("https://www.pma.org/directory/results.asp");
            assertThat(pma.seedUrl()).isEqualTo("https://www.pma.org");

            AssociationSource nema = catalog.find("NEMA").orElseThrow();
            assertThat(nema.url()).isNull();
            assertThat(nema.seedUrl()).isEqualTo("https://www.nema.org/membership/member-companies");
            assertThat(catalog.find("AGMA").orElseThrow().priority()).isNull();
        }
    }

    @Test
    void associations_키가_없으면_빈_카탈로그() throws IOException {
        // given
        InputStream in = new ByteArrayInputStream("other: value\n".getBytes(StandardCharsets.UTF_8));

        // when
        AssociationCatalog catalog = loader.load(in);

        // then
        assertThat(catalog.size()).isZero();
    }

    @Test
    void 경로로_로드(@TempDir Path directory) throws IOException {
        // given
        Path file = directory.resolve("associations.yml");
        Files.writeString(file, "associations:\n  SME:\n    url: https://www.sme.org\n");

        // when
        AssociationCatalog catalog = loader.load(file);

        // then
        assertThat(catalog.codes()).containsExactly("SME");
    }

    @Test
    void 없는_파일은_UncheckedIOException(@TempDir Path directory) {
        assertThatThrownBy(() -> loader.load(directory.resolve("missing.yml")))
            .isInstanceOf(UncheckedIOException.class)
            .hasMessageContaining("missing.yml");
    }
}
