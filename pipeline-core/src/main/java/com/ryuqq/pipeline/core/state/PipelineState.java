package com.ryuqq.pipeline.core.state;

import com.ryuqq.pipeline.core.phase.PhaseTransition;
import com.ryuqq.pipeline.core.phase.PipelinePhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * 파이프라인 실행 한 건의 전체 상태.
 *
 * <p>체크포인트/재개를 위해 모든 데이터 버킷과 진행 상황을 추적합니다.</p>
 *
 * <p><strong>데이터 버킷:</strong></p>
 * <ul>
 *   <li>crawlQueue: 처리 대기 URL</li>
 *   <li>visitedUrls / blockedUrls: 처리 완료 / 차단된 URL</li>
 *   <li>companies, events, participants, competitorSignals: 추출 레코드</li>
 *   <li>canonicalEntities: 해석된 정규 엔티티</li>
 *   <li>graphEdges, exports, errors</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>한 URL은 {crawlQueue, visitedUrls, blockedUrls} 중 최대 한 곳에만 존재</li>
 *   <li>누적 카운터는 감소하지 않음 (버킷이 병합/정리되어도 이력 보존)</li>
 *   <li>단계 전이는 {@link PhaseTransition} 규칙을 따르며 재진입 없음</li>
 * </ul>
 *
 * <p><strong>동시성:</strong> thread-safe하지 않습니다.
 * 한 시점에 하나의 단계 핸들러만 상태를 변경합니다 (single writer).</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class PipelineState {

    private static final Logger log = LoggerFactory.getLogger(PipelineState.class);

    private String jobId;
    private List<String> associationCodes;

    private PipelinePhase currentPhase;
    private Instant phaseStartedAt;
    private List<PhaseHistoryEntry> phaseHistory;

    private List<QueueItem> crawlQueue;
    private LinkedHashSet<String> visitedUrls;
    private LinkedHashSet<String> blockedUrls;
    private List<Map<String, Object>> companies;
    private List<Map<String, Object>> events;
    private List<Map<String, Object>> participants;
    private List<Map<String, Object>> competitorSignals;
    private List<Map<String, Object>> canonicalEntities;
    private List<Map<String, Object>> graphEdges;
    private List<Map<String, Object>> exports;
    private List<ErrorRecord> errors;

    private long totalUrlsDiscovered;
    private long totalPagesFetched;
    private long totalCompaniesExtracted;
    private long totalEventsExtracted;
    private long totalParticipantsExtracted;
    private long totalSignalsDetected;
    private long totalEntitiesResolved;

    private Instant createdAt;
    private Instant updatedAt;
    private Instant completedAt;

    // 역직렬화 전용
    private PipelineState() {
        this.associationCodes = new ArrayList<>();
        this.phaseHistory = new ArrayList<>();
        this.crawlQueue = new ArrayList<>();
        this.visitedUrls = new LinkedHashSet<>();
        this.blockedUrls = new LinkedHashSet<>();
        this.companies = new ArrayList<>();
        this.events = new ArrayList<>();
        this.participants = new ArrayList<>();
        this.competitorSignals = new ArrayList<>();
        this.canonicalEntities = new ArrayList<>();
        this.graphEdges = new ArrayList<>();
        this.exports = new ArrayList<>();
        this.errors = new ArrayList<>();
    }

    /**
     * 새 파이프라인 상태 생성 (INIT 단계).
     *
     * @param jobId 작업 ID (null 또는 빈 문자열이면 UUID 생성)
     * @param associationCodes 대상 연관 단체 코드 (순서 유지)
     * @return 새 PipelineState
     */
    public static PipelineState create(String jobId, List<String> associationCodes) {
        PipelineState state = new PipelineState();
        Instant now = Instant.now();
        state.jobId = (jobId == null || jobId.isBlank()) ? UUID.randomUUID().toString() : jobId;
        if (associationCodes != null) {
            state.associationCodes.addAll(associationCodes);
        }
        state.currentPhase = PipelinePhase.INIT;
        state.phaseStartedAt = now;
        state.createdAt = now;
        state.updatedAt = now;
        return state;
    }

    // ============================================================
    // 단계 전이
    // ============================================================

    /**
     * 새 단계로 전이.
     *
     * <p>허용되지 않은 전이는 경고 로그를 남기고 false를 반환하며 상태를 변경하지 않습니다.
     * 허용된 전이는 종료되는 단계의 이력을 기록합니다.</p>
     *
     * @param newPhase 전이할 단계
     * @return 전이 성공 여부
     */
    public boolean transitionTo(PipelinePhase newPhase) {
        if (!PhaseTransition.isAllowed(currentPhase, newPhase)) {
            log.warn("Invalid phase transition for job {}: {} → {} (allowed: {})",
                jobId, currentPhase, newPhase, PhaseTransition.allowedTargets(currentPhase));
            return false;
        }

        Instant now = Instant.now();
        phaseHistory.add(new PhaseHistoryEntry(currentPhase, newPhase, phaseStartedAt, now, statsSnapshot()));

        currentPhase = newPhase;
        phaseStartedAt = now;
        updatedAt = now;
        if (newPhase == PipelinePhase.DONE) {
            completedAt = now;
        }

        log.info("Pipeline {} transitioned to phase: {}", jobId, newPhase);
        return true;
    }

    private Map<String, Long> statsSnapshot() {
        Map<String, Long> stats = new LinkedHashMap<>();
        stats.put("urls_discovered", totalUrlsDiscovered);
        stats.put("pages_fetched", totalPagesFetched);
        stats.put("companies", totalCompaniesExtracted);
        stats.put("events", totalEventsExtracted);
        stats.put("participants", totalParticipantsExtracted);
        stats.put("entities_resolved", totalEntitiesResolved);
        return stats;
    }

    // ============================================================
    // URL 큐
    // ============================================================

    /**
     * URL을 크롤 큐에 추가.
     *
     * <p>이미 방문했거나 차단되었거나 큐에 있는 URL은 무시합니다.</p>
     *
     * @param item 큐 항목
     * @return 실제로 추가되었으면 true
     * @throws IllegalArgumentException item이 null인 경우
     */
    public boolean addToQueue(QueueItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        String url = item.url();
        if (visitedUrls.contains(url) || blockedUrls.contains(url) || isQueued(url)) {
            return false;
        }
        crawlQueue.add(item);
        totalUrlsDiscovered++;
        touch();
        return true;
    }

    /**
     * URL을 크롤 큐에 추가 (간편형).
     *
     * @param url 대상 URL
     * @param priority 우선순위
     * @return 실제로 추가되었으면 true
     */
    public boolean addToQueue(String url, int priority) {
        return addToQueue(QueueItem.of(url, priority));
    }

    /**
     * 우선순위가 가장 높은 큐 항목을 꺼냄.
     *
     * <p>같은 우선순위 중에서는 먼저 들어온 항목이 선택됩니다.</p>
     *
     * @return 다음 항목 (큐가 비어있으면 empty)
     */
    public Optional<QueueItem> nextUrl() {
        if (crawlQueue.isEmpty()) {
            return Optional.empty();
        }
        int bestIndex = 0;
        for (int i = 1; i < crawlQueue.size(); i++) {
            if (crawlQueue.get(i).priority() > crawlQueue.get(bestIndex).priority()) {
                bestIndex = i;
            }
        }
        QueueItem item = crawlQueue.remove(bestIndex);
        touch();
        return Optional.of(item);
    }

    /**
     * 큐에서 최대 limit개의 항목을 우선순위 순으로 꺼냄.
     *
     * @param limit 최대 개수
     * @return 꺼낸 항목 (우선순위 순)
     */
    public List<QueueItem> nextUrls(int limit) {
        List<QueueItem> batch = new ArrayList<>();
        while (batch.size() < limit) {
            Optional<QueueItem> next = nextUrl();
            if (next.isEmpty()) {
                break;
            }
            batch.add(next.get());
        }
        return batch;
    }

    /**
     * 큐 항목에 분류 결과 반영.
     *
     * @param url 대상 URL
     * @param pageType 판정된 페이지 유형
     * @param extractor 추천 추출기
     * @return 큐에 해당 URL이 있어 반영되었으면 true
     */
    public boolean classifyQueued(String url, String pageType, String extractor) {
        for (int i = 0; i < crawlQueue.size(); i++) {
            if (crawlQueue.get(i).url().equals(url)) {
                crawlQueue.set(i, crawlQueue.get(i).withClassification(pageType, extractor));
                touch();
                return true;
            }
        }
        return false;
    }

    /**
     * URL을 방문 완료로 표시.
     *
     * <p>큐에 남아있으면 제거합니다. 차단된 URL은 방문 처리하지 않습니다.</p>
     *
     * @param url 방문한 URL
     * @return 새로 방문 처리되었으면 true
     */
    public boolean markVisited(String url) {
        if (url == null || visitedUrls.contains(url) || blockedUrls.contains(url)) {
            return false;
        }
        removeFromQueue(url);
        visitedUrls.add(url);
        totalPagesFetched++;
        touch();
        return true;
    }

    /**
     * URL을 차단으로 표시.
     *
     * <p>큐에 남아있으면 제거합니다. 이미 방문한 URL은 차단 처리하지 않습니다.</p>
     *
     * @param url 차단할 URL
     * @param reason 차단 사유 (로그용, null 가능)
     * @return 새로 차단되었으면 true
     */
    public boolean markBlocked(String url, String reason) {
        if (url == null || blockedUrls.contains(url) || visitedUrls.contains(url)) {
            return false;
        }
        removeFromQueue(url);
        blockedUrls.add(url);
        touch();
        log.debug("Blocked {} for job {}: {}", url, jobId, reason);
        return true;
    }

    /**
     * URL이 큐에 있는지 확인.
     *
     * @param url 대상 URL
     * @return 큐에 있으면 true
     */
    public boolean isQueued(String url) {
        for (QueueItem item : crawlQueue) {
            if (item.url().equals(url)) {
                return true;
            }
        }
        return false;
    }

    private void removeFromQueue(String url) {
        Iterator<QueueItem> iterator = crawlQueue.iterator();
        while (iterator.hasNext()) {
            if (iterator.next().url().equals(url)) {
                iterator.remove();
                return;
            }
        }
    }

    // ============================================================
    // 레코드 버킷
    // ============================================================

    public void addCompany(Map<String, Object> company) {
        companies.add(company);
        totalCompaniesExtracted++;
        touch();
    }

    public void addEvent(Map<String, Object> event) {
        events.add(event);
        totalEventsExtracted++;
        touch();
    }

    public void addParticipant(Map<String, Object> participant) {
        participants.add(participant);
        totalParticipantsExtracted++;
        touch();
    }

    public void addSignal(Map<String, Object> signal) {
        competitorSignals.add(signal);
        totalSignalsDetected++;
        touch();
    }

    public void addCanonicalEntity(Map<String, Object> entity) {
        canonicalEntities.add(entity);
        totalEntitiesResolved++;
        touch();
    }

    public void addEdge(Map<String, Object> edge) {
        graphEdges.add(edge);
        touch();
    }

    public void addExport(Map<String, Object> export) {
        exports.add(export);
        touch();
    }

    /**
     * 오류 기록 추가 (추가 전용).
     *
     * @param error 오류 기록
     * @throws IllegalArgumentException error가 null인 경우
     */
    public void addError(ErrorRecord error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        errors.add(error);
        touch();
    }

    /**
     * 회사 버킷 교체 (보강/중복 제거 결과 반영).
     *
     * <p>누적 카운터는 변경하지 않습니다.</p>
     *
     * @param records 새 회사 레코드 목록
     */
    public void replaceCompanies(List<Map<String, Object>> records) {
        companies = new ArrayList<>(records);
        touch();
    }

    /**
     * 정규 엔티티 버킷 교체 (해석 결과 반영).
     *
     * <p>해석 카운터는 감소하지 않으며, 새 엔티티 수가 더 크면 그 값으로 올라갑니다.</p>
     *
     * @param entities 정규 엔티티 목록
     */
    public void replaceCanonicalEntities(List<Map<String, Object>> entities) {
        canonicalEntities = new ArrayList<>(entities);
        totalEntitiesResolved = Math.max(totalEntitiesResolved, entities.size());
        touch();
    }

    private void touch() {
        updatedAt = Instant.now();
    }

    // ============================================================
    // 스냅샷
    // ============================================================

    /**
     * 독립적인 사본 생성.
     *
     * <p>레코드 맵과 그 안의 중첩 맵/리스트까지 복사하므로
     * 사본을 변경해도 원본에 영향이 없습니다. 저장소 구현이 스냅샷 보관에 사용합니다.</p>
     *
     * @return 상태 사본
     */
    public PipelineState copy() {
        PipelineState copy = new PipelineState();
        copy.jobId = jobId;
        copy.associationCodes.addAll(associationCodes);
        copy.currentPhase = currentPhase;
        copy.phaseStartedAt = phaseStartedAt;
        copy.phaseHistory.addAll(phaseHistory);
        copy.crawlQueue.addAll(crawlQueue);
        copy.visitedUrls.addAll(visitedUrls);
        copy.blockedUrls.addAll(blockedUrls);
        copy.companies = copyRecords(companies);
        copy.events = copyRecords(events);
        copy.participants = copyRecords(participants);
        copy.competitorSignals = copyRecords(competitorSignals);
        copy.canonicalEntities = copyRecords(canonicalEntities);
        copy.graphEdges = copyRecords(graphEdges);
        copy.exports = copyRecords(exports);
        copy.errors.addAll(errors);
        copy.totalUrlsDiscovered = totalUrlsDiscovered;
        copy.totalPagesFetched = totalPagesFetched;
        copy.totalCompaniesExtracted = totalCompaniesExtracted;
        copy.totalEventsExtracted = totalEventsExtracted;
        copy.totalParticipantsExtracted = totalParticipantsExtracted;
        copy.totalSignalsDetected = totalSignalsDetected;
        copy.totalEntitiesResolved = totalEntitiesResolved;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        copy.completedAt = completedAt;
        return copy;
    }

    private static List<Map<String, Object>> copyRecords(List<Map<String, Object>> records) {
        List<Map<String, Object>> copies = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            copies.add(copyMap(record));
        }
        return copies;
    }

    private static Map<String, Object> copyMap(Map<?, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), copyValue(entry.getValue()));
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        return value;
    }

    // ============================================================
    // 요약
    // ============================================================

    /**
     * 현재 상태 요약 생성.
     *
     * @return 상태 요약
     */
    public StateSummary summary() {
        return new StateSummary(
            jobId,
            associationCodes,
            currentPhase,
            crawlQueue.size(),
            visitedUrls.size(),
            blockedUrls.size(),
            totalUrlsDiscovered,
            totalPagesFetched,
            totalCompaniesExtracted,
            totalEventsExtracted,
            totalParticipantsExtracted,
            totalSignalsDetected,
            totalEntitiesResolved,
            errors.size(),
            createdAt,
            updatedAt,
            completedAt
        );
    }

    // ============================================================
    // 조회 (읽기 전용 뷰)
    // ============================================================

    public String getJobId() {
        return jobId;
    }

    public List<String> getAssociationCodes() {
        return Collections.unmodifiableList(associationCodes);
    }

    public PipelinePhase getCurrentPhase() {
        return currentPhase;
    }

    public Instant getPhaseStartedAt() {
        return phaseStartedAt;
    }

    public List<PhaseHistoryEntry> getPhaseHistory() {
        return Collections.unmodifiableList(phaseHistory);
    }

    public List<QueueItem> getCrawlQueue() {
        return Collections.unmodifiableList(crawlQueue);
    }

    public Set<String> getVisitedUrls() {
        return Collections.unmodifiableSet(visitedUrls);
    }

    public Set<String> getBlockedUrls() {
        return Collections.unmodifiableSet(blockedUrls);
    }

    public List<Map<String, Object>> getCompanies() {
        return Collections.unmodifiableList(companies);
    }

    public List<Map<String, Object>> getEvents() {
        return Collections.unmodifiableList(events);
    }

    public List<Map<String, Object>> getParticipants() {
        return Collections.unmodifiableList(participants);
    }

    public List<Map<String, Object>> getCompetitorSignals() {
        return Collections.unmodifiableList(competitorSignals);
    }

    public List<Map<String, Object>> getCanonicalEntities() {
        return Collections.unmodifiableList(canonicalEntities);
    }

    public List<Map<String, Object>> getGraphEdges() {
        return Collections.unmodifiableList(graphEdges);
    }

    public List<Map<String, Object>> getExports() {
        return Collections.unmodifiableList(exports);
    }

    public List<ErrorRecord> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    public long getTotalUrlsDiscovered() {
        return totalUrlsDiscovered;
    }

    public long getTotalPagesFetched() {
        return totalPagesFetched;
    }

    public long getTotalCompaniesExtracted() {
        return totalCompaniesExtracted;
    }

    public long getTotalEventsExtracted() {
        return totalEventsExtracted;
    }

    public long getTotalParticipantsExtracted() {
        return totalParticipantsExtracted;
    }

    public long getTotalSignalsDetected() {
        return totalSignalsDetected;
    }

    public long getTotalEntitiesResolved() {
        return totalEntitiesResolved;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    @Override
    public String toString() {
        return "PipelineState{jobId=" + jobId + ", phase=" + currentPhase + ", queue=" + crawlQueue.size() + '}';
    }
}
