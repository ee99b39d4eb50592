package com.chicu.forecastguard.weights;

import com.chicu.forecastguard.common.error.ModelUnavailableException;
import com.chicu.forecastguard.common.util.ParameterCodes;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * Веса на общем volume (PVC), который читают inference-поды:
 * <pre>
 * models/latest_T2M.pt      + latest_T2M.version
 * models/previous_T2M.pt    + previous_T2M.version
 * models/versions/v20261019_120000_123_T2M.pt
 * </pre>
 * latest_*.pt остаётся "сырым" payload, чтобы serving мог грузить его напрямую.
 * Запись через temp-файл + atomic move, под локом параметра.
 */
@Slf4j
public class FileSystemWeightStore implements WeightStore {

    private static final String LATEST = "latest";
    private static final String PREVIOUS = "previous";
    private static final String EXT = ".pt";
    private static final String VERSION_EXT = ".version";

    private final Path root;
    private final Path versionsDir;
    private final VersionIdGenerator versions;
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public FileSystemWeightStore(Path root, VersionIdGenerator versions) {
        this.root = root;
        this.versionsDir = root.resolve("versions");
        this.versions = versions;
        try {
            Files.createDirectories(versionsDir);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create models dir " + root + ": " + e.getMessage(), e);
        }
        log.info("💾 FileSystemWeightStore root={}", root.toAbsolutePath());
    }

    @Override
    public Optional<WeightArtifact> writeLatestIf(String parameter, byte[] payload, BooleanSupplier gate) {
        String p = ParameterCodes.normalize(parameter);
        if (payload == null) throw new IllegalArgumentException("payload=null");

        ReentrantLock lock = lockOf(p);
        lock.lock();
        try {
            if (!gate.getAsBoolean()) {
                log.warn("💾 WRITE REFUSED param={}: gate closed", p);
                return Optional.empty();
            }
            Instant at = versions.nextInstant();
            String versionId = VersionIdGenerator.format(at);

            // история пишется один раз и больше не трогается
            writeAtomically(versionsDir.resolve(versionId + "_" + p + EXT), payload);
            writeAtomically(payloadPath(LATEST, p), payload);
            writeAtomically(versionPath(LATEST, p), versionId.getBytes(StandardCharsets.UTF_8));

            log.info("💾 WRITE LATEST param={} version={} bytes={}", p, versionId, payload.length);

            return Optional.of(WeightArtifact.builder()
                    .parameter(p)
                    .versionId(versionId)
                    .payload(payload.clone())
                    .createdAt(at)
                    .build());
        } catch (IOException e) {
            throw new IllegalStateException("[" + p + "] write latest failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<WeightArtifact> findLatest(String parameter) {
        return readSlot(LATEST, ParameterCodes.normalize(parameter));
    }

    @Override
    public Optional<WeightArtifact> findPrevious(String parameter) {
        return readSlot(PREVIOUS, ParameterCodes.normalize(parameter));
    }

    @Override
    public void snapshotLatestToPrevious(String parameter) {
        String p = ParameterCodes.normalize(parameter);
        copySlot(LATEST, PREVIOUS, p);
        log.info("💾 BACKUP param={} latest -> previous", p);
    }

    @Override
    public void restorePreviousToLatest(String parameter) {
        String p = ParameterCodes.normalize(parameter);
        copySlot(PREVIOUS, LATEST, p);
        log.info("💾 RESTORE param={} previous -> latest", p);
    }

    @Override
    public List<String> listVersions(String parameter) {
        String p = ParameterCodes.normalize(parameter);
        String suffix = "_" + p + EXT;

        List<String> out = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(versionsDir, "v*" + suffix)) {
            for (Path f : ds) {
                String name = f.getFileName().toString();
                out.add(name.substring(0, name.length() - suffix.length()));
            }
        } catch (IOException e) {
            throw new IllegalStateException("[" + p + "] list versions failed: " + e.getMessage(), e);
        }
        // формат версии сортируется лексикографически
        out.sort(String::compareTo);
        return out;
    }

    // =========================================================
    // helpers
    // =========================================================

    private Optional<WeightArtifact> readSlot(String slot, String p) {
        ReentrantLock lock = lockOf(p);
        lock.lock();
        try {
            Path payloadFile = payloadPath(slot, p);
            if (!Files.exists(payloadFile)) return Optional.empty();

            byte[] payload = Files.readAllBytes(payloadFile);
            Path versionFile = versionPath(slot, p);
            String versionId = Files.exists(versionFile)
                    ? Files.readString(versionFile, StandardCharsets.UTF_8).trim()
                    : "unknown";

            return Optional.of(WeightArtifact.builder()
                    .parameter(p)
                    .versionId(versionId)
                    .payload(payload)
                    .createdAt(Files.getLastModifiedTime(payloadFile).toInstant())
                    .build());
        } catch (IOException e) {
            // нечитаемые веса = модели нет, оценка уходит в sentinel
            throw new ModelUnavailableException(p, "read " + slot + " failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private void copySlot(String from, String to, String p) {
        ReentrantLock lock = lockOf(p);
        lock.lock();
        try {
            Path src = payloadPath(from, p);
            if (!Files.exists(src)) {
                // источника нет -> цель тоже пустая, иначе это не инверсия
                Files.deleteIfExists(payloadPath(to, p));
                Files.deleteIfExists(versionPath(to, p));
                log.warn("💾 slot {} empty for param={}, cleared {}", from, p, to);
                return;
            }

            writeAtomically(payloadPath(to, p), Files.readAllBytes(src));

            Path srcVersion = versionPath(from, p);
            if (Files.exists(srcVersion)) {
                writeAtomically(versionPath(to, p), Files.readAllBytes(srcVersion));
            } else {
                Files.deleteIfExists(versionPath(to, p));
            }
        } catch (IOException e) {
            throw new IllegalStateException("[" + p + "] copy " + from + " -> " + to + " failed: " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    private void writeAtomically(Path target, byte[] bytes) throws IOException {
        Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.write(tmp, bytes);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private Path payloadPath(String slot, String p) {
        return root.resolve(slot + "_" + p + EXT);
    }

    private Path versionPath(String slot, String p) {
        return root.resolve(slot + "_" + p + VERSION_EXT);
    }

    private ReentrantLock lockOf(String p) {
        return locks.computeIfAbsent(p, k -> new ReentrantLock());
    }
}
