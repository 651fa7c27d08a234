package com.ai.webscraper.cache;

import com.ai.webscraper.config.ScraperConfig;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 입력 해시 기반 AI 추출 결과 캐시.
 * 테이블 변경은 모두 lock 안에서 끝나며, 파일 저장은 스냅샷을 만든 뒤 lock 밖에서 통째로 다시 쓴다.
 * 파일은 단일 프로세스 전용이다.
 */
@Slf4j
@Component
public class ResponseCache {

    static final String FILE_VERSION = "1.0";
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final Map<String, CacheEntry> entries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final ReentrantLock fileLock = new ReentrantLock();
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Duration ttl;
    private final int maxEntries;
    private final Path filePath;
    private final Clock clock;

    @Autowired
    public ResponseCache(ScraperConfig scraperConfig, Clock clock) {
        this(scraperConfig.getCache().getTtl(),
                scraperConfig.getCache().getMaxEntries(),
                toPath(scraperConfig.getCache().getFilePath()),
                clock);
    }

    public ResponseCache(Duration ttl, int maxEntries, Path filePath, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1");
        }
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.filePath = filePath;
        this.clock = clock;
    }

    private static Path toPath(String path) {
        return path == null || path.isBlank() ? null : Path.of(path);
    }

    @PostConstruct
    public void initialize() {
        if (filePath != null) {
            loadFromFile();
        }
        log.info("ResponseCache 초기화 완료 - TTL: {}, 최대 항목: {}, 파일: {}", ttl, maxEntries, filePath);
    }

    /**
     * 유효한 항목 조회. 만료된 항목은 즉시 제거하고 miss로 처리한다.
     */
    public Optional<CacheEntry> get(String key) {
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                log.debug("캐시 miss: {}", CacheKeys.abbreviate(key));
                return Optional.empty();
            }
            if (!entry.isValid(ttl, clock)) {
                entries.remove(key);
                log.debug("캐시 만료: {}", CacheKeys.abbreviate(key));
                return Optional.empty();
            }
            log.debug("캐시 hit: {}", CacheKeys.abbreviate(key));
            return Optional.of(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 저장 후 정리 (만료 제거 → 오래된 순 제거), 파일 경로가 있으면 전체 테이블을 파일로 저장
     */
    public void store(String key, Map<String, Object> data, String rawResponse) {
        Map<String, Object> snapshot = null;
        lock.lock();
        try {
            entries.put(key, new CacheEntry(key, data, rawResponse, clock.instant()));
            log.debug("캐시 저장: {}", CacheKeys.abbreviate(key));
            cleanup();
            if (filePath != null) {
                snapshot = snapshot();
            }
        } finally {
            lock.unlock();
        }

        if (snapshot != null) {
            writeFile(snapshot);
        }
    }

    /**
     * 전체 삭제 (파일 포함)
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        log.info("캐시 초기화됨");

        if (filePath != null) {
            fileLock.lock();
            try {
                if (Files.deleteIfExists(filePath)) {
                    log.debug("캐시 파일 삭제: {}", filePath);
                }
            } catch (IOException e) {
                log.warn("캐시 파일 삭제 실패: {}", filePath, e);
            } finally {
                fileLock.unlock();
            }
        }
    }

    public Map<String, Object> getStats() {
        lock.lock();
        try {
            long valid = entries.values().stream().filter(e -> e.isValid(ttl, clock)).count();
            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("totalEntries", entries.size());
            stats.put("validEntries", valid);
            stats.put("expiredEntries", entries.size() - valid);
            stats.put("maxAge", ttl.toString());
            stats.put("maxEntries", maxEntries);
            stats.put("cacheFilePath", filePath == null ? null : filePath.toString());
            return stats;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 종료 시 파일 저장 후 메모리 비움
     */
    @PreDestroy
    public void dispose() {
        Map<String, Object> snapshot = null;
        lock.lock();
        try {
            if (filePath != null) {
                snapshot = snapshot();
            }
            entries.clear();
        } finally {
            lock.unlock();
        }
        if (snapshot != null) {
            writeFile(snapshot);
        }
        log.info("ResponseCache 종료");
    }

    // lock 보유 상태에서 호출
    private void cleanup() {
        List<String> expired = new ArrayList<>();
        entries.forEach((key, entry) -> {
            if (!entry.isValid(ttl, clock)) {
                expired.add(key);
            }
        });
        expired.forEach(entries::remove);
        if (!expired.isEmpty()) {
            log.debug("만료 항목 {}개 제거", expired.size());
        }

        int overflow = entries.size() - maxEntries;
        if (overflow > 0) {
            entries.values().stream()
                    .sorted(Comparator.comparing(CacheEntry::timestamp))
                    .limit(overflow)
                    .map(CacheEntry::key)
                    .toList()
                    .forEach(entries::remove);
            log.debug("용량 초과로 오래된 항목 {}개 제거", overflow);
        }
    }

    // lock 보유 상태에서 호출
    private Map<String, Object> snapshot() {
        Map<String, Object> serialized = new LinkedHashMap<>();
        entries.forEach((key, entry) -> serialized.put(key, entry.toJson()));

        Map<String, Object> file = new LinkedHashMap<>();
        file.put("version", FILE_VERSION);
        file.put("timestamp", clock.instant().toString());
        file.put("entries", serialized);
        return file;
    }

    private void writeFile(Map<String, Object> snapshot) {
        fileLock.lock();
        try {
            Path parent = filePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = Files.createTempFile(parent, "response-cache", ".tmp");
            objectMapper.writeValue(temp.toFile(), snapshot);
            try {
                Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, filePath, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("캐시 파일 저장: {}개 항목", ((Map<?, ?>) snapshot.get("entries")).size());
        } catch (IOException e) {
            log.warn("캐시 파일 저장 실패: {}", filePath, e);
        } finally {
            fileLock.unlock();
        }
    }

    @SuppressWarnings("unchecked")
    private void loadFromFile() {
        if (!Files.exists(filePath)) {
            log.debug("캐시 파일 없음, 빈 캐시로 시작: {}", filePath);
            return;
        }

        try {
            Map<String, Object> json = objectMapper.readValue(filePath.toFile(), MAP_TYPE);
            Object rawEntries = json.get("entries");
            if (!(rawEntries instanceof Map)) {
                log.warn("캐시 파일 형식 오류 (entries 없음): {}", filePath);
                return;
            }

            int loaded = 0;
            lock.lock();
            try {
                for (Map.Entry<String, Object> item : ((Map<String, Object>) rawEntries).entrySet()) {
                    try {
                        CacheEntry entry = CacheEntry.fromJson(item.getKey(), (Map<String, Object>) item.getValue());
                        if (entry.isValid(ttl, clock)) {
                            entries.put(item.getKey(), entry);
                            loaded++;
                        }
                    } catch (RuntimeException e) {
                        log.warn("캐시 항목 로드 실패 {}: {}", CacheKeys.abbreviate(item.getKey()), e.getMessage());
                    }
                }
            } finally {
                lock.unlock();
            }
            log.info("캐시 파일에서 유효 항목 {}개 로드", loaded);
        } catch (IOException e) {
            log.warn("캐시 파일 로드 실패: {}", filePath, e);
        }
    }
}
