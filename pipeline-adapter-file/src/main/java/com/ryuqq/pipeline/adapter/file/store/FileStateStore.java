package com.ryuqq.pipeline.adapter.file.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.pipeline.adapter.file.json.PipelineObjectMappers;
import com.ryuqq.pipeline.core.phase.PipelinePhase;
import com.ryuqq.pipeline.core.spi.CheckpointSummary;
import com.ryuqq.pipeline.core.spi.JobInfo;
import com.ryuqq.pipeline.core.spi.StateStore;
import com.ryuqq.pipeline.core.spi.StateStoreException;
import com.ryuqq.pipeline.core.state.PipelineState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * JSON 파일 기반 {@link StateStore} 구현체.
 *
 * <p><strong>파일 구성 (디렉토리 하나):</strong></p>
 * <ul>
 *   <li>{@code {job_id}.state.json} - 전체 상태 (임시 파일에 쓴 뒤 이동하여 원자적으로 교체)</li>
 *   <li>{@code {job_id}.{PHASE}.checkpoint.json} - 단계별 체크포인트 요약 (같은 단계는 덮어씀)</li>
 * </ul>
 *
 * <p>손상된 상태 파일은 {@link #listJobs(boolean)}에서 경고 후 건너뛰고,
 * {@link #load(String)}에서는 {@link StateStoreException}으로 보고합니다.</p>
 *
 * <p><strong>동시성:</strong> 한 작업은 한 프로세스만 쓴다고 가정합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class FileStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(FileStateStore.class);

    static final String STATE_SUFFIX = ".state.json";
    static final String CHECKPOINT_SUFFIX = ".checkpoint.json";
    private static final String TEMP_SUFFIX = ".tmp";

    private final Path directory;
    private final ObjectMapper mapper;

    public FileStateStore(Path directory) {
        this(directory, PipelineObjectMappers.json());
    }

    /**
     * 생성자.
     *
     * @param directory 상태 디렉토리 (없으면 생성)
     * @param mapper JSON 매퍼
     * @throws StateStoreException 디렉토리를 만들 수 없는 경우
     */
    public FileStateStore(Path directory, ObjectMapper mapper) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.directory = directory;
        this.mapper = mapper;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StateStoreException("Cannot create state directory: " + directory, e);
        }
    }

    @Override
    public void save(PipelineState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        Path target = statePath(state.getJobId());
        writeAtomically(target, state);
        log.debug("Saved state for job {} to {}", state.getJobId(), target);
    }

    @Override
    public Optional<PipelineState> load(String jobId) {
        Path path = statePath(jobId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(path.toFile(), PipelineState.class));
        } catch (IOException e) {
            throw new StateStoreException("Failed to read state for job " + jobId + ": " + path, e);
        }
    }

    @Override
    public void writeCheckpoint(CheckpointSummary checkpoint) {
        if (checkpoint == null) {
            throw new IllegalArgumentException("checkpoint cannot be null");
        }
        Path target = directory.resolve(
            validJobId(checkpoint.jobId()) + "." + checkpoint.phase().name() + CHECKPOINT_SUFFIX);
        writeAtomically(target, checkpoint);
        log.debug("Wrote checkpoint {}", target);
    }

    @Override
    public Optional<CheckpointSummary> latestCheckpoint(String jobId) {
        CheckpointSummary latest = null;
        for (Path path : checkpointFiles(jobId)) {
            CheckpointSummary checkpoint;
            try {
                checkpoint = mapper.readValue(path.toFile(), CheckpointSummary.class);
            } catch (IOException e) {
                log.warn("Skipping unreadable checkpoint {}: {}", path, e.getMessage());
                continue;
            }
            if (latest == null || checkpoint.timestamp().isAfter(latest.timestamp())) {
                latest = checkpoint;
            }
        }
        return Optional.ofNullable(latest);
    }

    @Override
    public List<JobInfo> listJobs(boolean includeCompleted) {
        List<JobInfo> jobs = new ArrayList<>();
        for (Path path : list("*" + STATE_SUFFIX)) {
            PipelineState state;
            try {
                state = mapper.readValue(path.toFile(), PipelineState.class);
            } catch (IOException e) {
                log.warn("Skipping corrupt state file {}: {}", path, e.getMessage());
                continue;
            }
            JobInfo info = JobInfo.from(state);
            if (includeCompleted || !info.completed()) {
                jobs.add(info);
            }
        }
        jobs.sort(Comparator.comparing(JobInfo::updatedAt).reversed());
        return jobs;
    }

    @Override
    public boolean delete(String jobId) {
        boolean deleted;
        try {
            deleted = Files.deleteIfExists(statePath(jobId));
            for (Path checkpoint : checkpointFiles(jobId)) {
                deleted |= Files.deleteIfExists(checkpoint);
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to delete job " + jobId, e);
        }
        if (deleted) {
            log.info("Deleted state files for job {}", jobId);
        }
        return deleted;
    }

    // ============================================================
    // 파일 처리
    // ============================================================

    private Path statePath(String jobId) {
        return directory.resolve(validJobId(jobId) + STATE_SUFFIX);
    }

    private List<Path> checkpointFiles(String jobId) {
        String prefix = validJobId(jobId) + ".";
        List<Path> files = new ArrayList<>();
        for (Path path : list(prefix + "*" + CHECKPOINT_SUFFIX)) {
            String name = path.getFileName().toString();
            String phase = name.substring(prefix.length(), name.length() - CHECKPOINT_SUFFIX.length());
            if (isPhase(phase)) {
                files.add(path);
            }
        }
        return files;
    }

    private List<Path> list(String glob) {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to list state directory: " + directory, e);
        }
        files.sort(Comparator.comparing(Path::toString));
        return files;
    }

    private void writeAtomically(Path target, Object value) {
        Path temp = target.resolveSibling(target.getFileName() + TEMP_SUFFIX);
        try {
            mapper.writeValue(temp.toFile(), value);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new StateStoreException("Failed to write " + target, e);
        }
    }

    private static boolean isPhase(String name) {
        for (PipelinePhase phase : PipelinePhase.values()) {
            if (phase.name().equals(name)) {
                return true;
            }
        }
        return false;
    }

    // 작업 ID가 파일 이름 하나로만 해석되도록 제한
    private static String validJobId(String jobId) {
        if (jobId == null || jobId.isBlank()) {
            throw new IllegalArgumentException("jobId cannot be null or blank");
        }
        if (jobId.contains("/") || jobId.contains("\\") || jobId.contains("..")) {
            throw new IllegalArgumentException("jobId cannot contain path separators: " + jobId);
        }
        return jobId;
    }
}
