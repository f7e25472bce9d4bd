package com.ryuqq.pipeline.adapter.file.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.pipeline.adapter.file.json.PipelineObjectMappers;
import com.ryuqq.pipeline.application.catalog.AssociationCatalog;
import com.ryuqq.pipeline.application.catalog.AssociationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * YAML 단체 설정 파일 로더.
 *
 * <p><strong>형식:</strong></p>
 * <pre>
 * associations:
 *   PMA:
 *     name: Precision Metalforming Association
 *     url: https://www.pma.org
 *     directory_url: https://www.pma.org/directory
 *     priority: high
 * </pre>
 *
 * <p>키가 단체 코드이며 파일에 적힌 순서가 카탈로그 순서가 됩니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class YamlAssociationCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(YamlAssociationCatalogLoader.class);

    private final ObjectMapper mapper;

    public YamlAssociationCatalogLoader() {
        this.mapper = PipelineObjectMappers.yaml();
    }

    /**
     * 파일에서 카탈로그 로드.
     *
     * @param path YAML 파일 경로
     * @return 단체 카탈로그
     * @throws UncheckedIOException 파일을 읽거나 해석할 수 없는 경우
     */
    public AssociationCatalog load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        try (InputStream in = Files.newInputStream(path)) {
            AssociationCatalog catalog = load(in);
            log.info("Loaded {} associations from {}", catalog.size(), path);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load associations from " + path, e);
        }
    }

    /**
     * 스트림에서 카탈로그 로드 (스트림은 닫지 않음).
     */
    public AssociationCatalog load(InputStream in) throws IOException {
        if (in == null) {
            throw new IllegalArgumentException("in cannot be null");
        }
        CatalogDocument document = mapper.readValue(in, CatalogDocument.class);
        if (document == null || document.associations() == null) {
            return AssociationCatalog.empty();
        }

        List<AssociationSource> sources = new ArrayList<>();
        for (Map.Entry<String, AssociationEntry> entry : document.associations().entrySet()) {
            AssociationEntry value = entry.getValue();
            if (value == null) {
                sources.add(new AssociationSource(entry.getKey(), null, null, null, null));
            } else {
                sources.add(new AssociationSource(entry.getKey(), value.name(), value.url(),
                    value.directoryUrl(), value.priority()));
            }
        }
        return AssociationCatalog.of(sources);
    }

    record CatalogDocument(Map<String, AssociationEntry> associations) {
    }

    record AssociationEntry(String name, String url, String directoryUrl, String priority) {
    }
}
