package com.ryuqq.contextguard.adapter.yaml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ryuqq.contextguard.adapter.yaml.document.ContractDocument;
import com.ryuqq.contextguard.core.model.ContextContract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;

/**
 * YAML 계약 로더.
 *
 * <p>Jackson {@link ObjectMapper}({@link YAMLFactory})로 계약 파일을 {@link ContractDocument}에 바인딩한 뒤
 * {@link ContextContract}로 변환합니다. 선언되지 않은 키는 거부됩니다.</p>
 *
 * <p><strong>캐시:</strong></p>
 * <ul>
 *   <li>{@link #load(Path)}: 절대 정규화 경로 기준으로 결과를 캐시</li>
 *   <li>{@link #loadFromString(String)}, {@link #loadResource(String)}: 캐시하지 않음</li>
 *   <li>{@link #clearCache()}: 캐시 비우기</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * YamlContractLoader loader = new YamlContractLoader();
 * ContextContract contract = loader.load(Path.of("contracts/sdlc.yaml"));
 * </pre>
 *
 * <p>Thread-safe: 캐시는 {@link ConcurrentHashMap}이며 ObjectMapper는 설정 이후 공유 가능합니다.</p>
 *
 * @author ContextGuard Team
 * @since 1.0.0
 */
public final class YamlContractLoader {

    private static final Logger log = LoggerFactory.getLogger(YamlContractLoader.class);

    private static final String STRING_SOURCE = "<string>";

    private final ObjectMapper mapper;
    private final ConcurrentHashMap<Path, ContextContract> cache = new ConcurrentHashMap<>();

    public YamlContractLoader() {
        this.mapper = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * 파일에서 계약 로딩 (경로별 캐시).
     *
     * @param path 계약 파일 경로
     * @return ContextContract
     * @throws ContractLoadException 파일이 없거나 계약이 올바르지 않은 경우
     * @throws IllegalArgumentException path가 null인 경우
     */
    public ContextContract load(Path path) {
        if (path == null) {
            throw new IllegalArgumentException("path cannot be null");
        }
        Path key = path.toAbsolutePath().normalize();
        ContextContract cached = cache.get(key);
        if (cached != null) {
            log.debug("Contract cache hit: {}", key);
            return cached;
        }

        String yaml;
        try {
            yaml = Files.readString(key, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new ContractLoadException(key.toString(), "file not found", e);
        } catch (IOException e) {
            throw new ContractLoadException(key.toString(), "cannot read file (" + e.getMessage() + ")", e);
        }

        ContextContract contract = parse(yaml, key.toString());
        ContextContract previous = cache.putIfAbsent(key, contract);
        log.info("Loaded contract '{}' (schema {}, {} phases, {} chains) from {}",
            contract.pipelineId(), contract.schemaVersion(), contract.phases().size(),
            contract.propagationChains().size(), key);
        return previous != null ? previous : contract;
    }

    /**
     * 문자열에서 계약 로딩 (캐시하지 않음).
     *
     * @param yaml YAML 텍스트
     * @return ContextContract
     * @throws ContractLoadException 계약이 올바르지 않은 경우
     */
    public ContextContract loadFromString(String yaml) {
        if (yaml == null) {
            throw new IllegalArgumentException("yaml cannot be null");
        }
        return parse(yaml, STRING_SOURCE);
    }

    /**
     * 클래스패스 리소스에서 계약 로딩 (캐시하지 않음).
     *
     * @param resource 리소스 이름 (예: {@code contracts/sdlc.yaml})
     * @return ContextContract
     * @throws ContractLoadException 리소스가 없거나 계약이 올바르지 않은 경우
     */
    public ContextContract loadResource(String resource) {
        if (resource == null || resource.isBlank()) {
            throw new IllegalArgumentException("resource cannot be null or blank");
        }
        String source = "classpath:" + resource;
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = YamlContractLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ContractLoadException(source, "resource not found");
            }
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8), source);
        } catch (IOException e) {
            throw new ContractLoadException(source, "cannot read resource (" + e.getMessage() + ")", e);
        }
    }

    public void clearCache() {
        cache.clear();
    }

    int cacheSize() {
        return cache.size();
    }

    private ContextContract parse(String yaml, String source) {
        ContractDocument document;
        try {
            document = mapper.readValue(yaml, ContractDocument.class);
        } catch (UnrecognizedPropertyException e) {
            throw new ContractLoadException(source, "unknown key '" + e.getPropertyName() + "' at "
                + e.getPathReference(), e);
        } catch (JsonProcessingException e) {
            throw new ContractLoadException(source, e.getOriginalMessage(), e);
        }
        return new ContractDocumentMapper(source).toContract(document);
    }
}
