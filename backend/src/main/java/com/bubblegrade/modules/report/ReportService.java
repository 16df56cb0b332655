package com.bubblegrade.modules.report;

import com.bubblegrade.modules.report.dto.*;
import com.bubblegrade.modules.roster.Section;
import com.bubblegrade.modules.roster.StudentRepository;
import com.bubblegrade.modules.scan.Scan;
import com.bubblegrade.modules.scan.ScanQuery;
import com.bubblegrade.modules.scan.ScanStatus;
import com.bubblegrade.modules.scan.ScanStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Performance-level and item-analysis reports for one exam across the sections
 * of a class. Recomputed on every request.
 *
 * <p>Sections are loaded in parallel; overall figures are computed from the
 * summed section tables.
 */
@Slf4j
@Service
public class ReportService {

    private static final String OVERALL_ID = "overall";
    private static final String OVERALL_NAME = "Overall";

    private final ReportContextLoader contextLoader;
    private final StudentRepository studentRepository;
    private final ScanStore scanStore;
    private final Executor reportExecutor;

    public ReportService(ReportContextLoader contextLoader, StudentRepository studentRepository, ScanStore scanStore,
            @Qualifier("reportExecutor") Executor reportExecutor) {
        this.contextLoader = contextLoader;
        this.studentRepository = studentRepository;
        this.scanStore = scanStore;
        this.reportExecutor = reportExecutor;
    }

    public PlReport getPlEntries(UUID gradeId, UUID classId, UUID examId, ReportView view) {
        ReportContext context = contextLoader.load(gradeId, classId, examId);
        List<SectionSample> samples = sampleSections(context);

        List<DistributionTable> tables = new ArrayList<>();
        List<PlSectionReport> sections = new ArrayList<>();
        for (SectionSample sample : samples) {
            DistributionTable table = sample.distribution(context);
            tables.add(table);
            sections.add(plReport(context, sample.section().getId().toString(), sample.section().displayName(),
                    table, sample.totalStudents(), sample.scoredCount()));
        }

        PlSectionReport overall = null;
        if (view == ReportView.OVERALL) {
            DistributionTable merged = DistributionTable.merge(context.topScore(), tables);
            int students = samples.stream().mapToInt(SectionSample::totalStudents).sum();
            int scans = samples.stream().mapToInt(SectionSample::scoredCount).sum();
            overall = plReport(context, OVERALL_ID, OVERALL_NAME, merged, students, scans);
        }
        return PlReport.builder().view(view).sections(sections).overall(overall).build();
    }

    public ItemReport getItemEntries(UUID gradeId, UUID classId, UUID examId, ReportView view) {
        ReportContext context = contextLoader.load(gradeId, classId, examId);
        List<SectionSample> samples = sampleSections(context);

        List<ItemTally> tallies = new ArrayList<>();
        List<ItemSectionReport> sections = new ArrayList<>();
        for (SectionSample sample : samples) {
            ItemTally tally = sample.tally(context);
            tallies.add(tally);
            sections.add(ItemSectionReport.builder()
                    .sectionId(sample.section().getId().toString())
                    .sectionName(sample.section().displayName())
                    .items(tally.toRows())
                    .totalStudents(sample.totalStudents())
                    .totalQuestions(tally.questionCount())
                    .studentsTookExam(tally.studentsTookExam())
                    .sectionTotalCorrect(tally.totalCorrect())
                    .build());
        }

        ItemOverallReport overall = null;
        if (view == ReportView.OVERALL) {
            overall = itemOverall(ItemTally.merge(context.answerKey(), tallies));
        }
        return ItemReport.builder().view(view).sections(sections).overall(overall).build();
    }

    /** One row per section plus the overall row, as on the exported summary sheet. */
    public SummaryReport getSummary(UUID gradeId, UUID classId, UUID examId) {
        ReportContext context = contextLoader.load(gradeId, classId, examId);
        List<SectionSample> samples = sampleSections(context);

        List<DistributionTable> tables = new ArrayList<>();
        List<ItemTally> tallies = new ArrayList<>();
        List<SummaryRow> rows = new ArrayList<>();
        for (SectionSample sample : samples) {
            DistributionTable table = sample.distribution(context);
            ItemTally tally = sample.tally(context);
            tables.add(table);
            tallies.add(tally);
            rows.add(summaryRow(sample.section().getId().toString(), sample.section().displayName(),
                    tally.studentsTookExam(), sample.totalStudents(),
                    table.statistics(context.totalPoints()).rounded()));
        }

        PerformanceStatistics overallStats = DistributionTable.merge(context.topScore(), tables)
                .statistics(context.totalPoints()).rounded();
        ItemTally overallTally = ItemTally.merge(context.answerKey(), tallies);
        SummaryRow overall = summaryRow(OVERALL_ID, OVERALL_NAME, overallTally.studentsTookExam(),
                samples.stream().mapToInt(SectionSample::totalStudents).sum(), overallStats);

        return SummaryReport.builder()
                .gradeName(context.grade().getName())
                .className(context.schoolClass().getName())
                .examName(context.exam().getName())
                .academicYear(context.schoolClass().getAcademicYear())
                .sections(rows)
                .overall(overall)
                .build();
    }

    private List<SectionSample> sampleSections(ReportContext context) {
        List<CompletableFuture<SectionSample>> futures = context.sections().stream()
                .map(section -> CompletableFuture.supplyAsync(() -> sample(context, section), reportExecutor))
                .toList();
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    /**
     * Scored scans of a section's students, keeping only each student's most
     * recent one.
     */
    SectionSample sample(ReportContext context, Section section) {
        List<UUID> studentIds = studentRepository.findActiveIdsInSection(section.getId(),
                context.schoolClass().getId());
        if (studentIds.isEmpty()) {
            return new SectionSample(section, 0, List.of());
        }

        List<Scan> scans = scanStore.find(new ScanQuery.ByExamForStudents(context.exam().getId(), studentIds,
                ScanStatus.SCORED));
        Map<UUID, Scan> latest = new LinkedHashMap<>();
        for (Scan scan : scans) {
            // newest first
            latest.putIfAbsent(scan.studentId(), scan);
        }
        log.debug("Section {}: {} students, {} scored scans, {} used", section.getId(), studentIds.size(),
                scans.size(), latest.size());
        return new SectionSample(section, studentIds.size(), List.copyOf(latest.values()));
    }

    private static PlSectionReport plReport(ReportContext context, String id, String name, DistributionTable table,
            int students, int scans) {
        return PlSectionReport.builder()
                .sectionId(id)
                .sectionName(name)
                .statistics(table.statistics(context.totalPoints()).rounded())
                .distribution(table.rows())
                .totalPoints(context.totalPoints())
                .studentCount(students)
                .scanCount(scans)
                .numberOfItems(context.answerKey().answers().size())
                .build();
    }

    private static ItemOverallReport itemOverall(ItemTally tally) {
        long possible = (long) tally.studentsTookExam() * tally.questionCount();
        double percentage = possible > 0 ? (tally.totalCorrect() * 100.0) / possible : 0;
        return ItemOverallReport.builder()
                .items(tally.toRows())
                .totalStudentsTookExam(tally.studentsTookExam())
                .totalQuestions(tally.questionCount())
                .totalCorrect(tally.totalCorrect())
                .totalPossible(possible)
                .overallPercentage(Rounding.twoDecimals(percentage))
                .build();
    }

    private static SummaryRow summaryRow(String id, String name, int tookExam, int totalStudents,
            PerformanceStatistics stats) {
        return SummaryRow.builder()
                .sectionId(id)
                .sectionName(name)
                .studentsTookExam(tookExam)
                .totalStudents(totalStudents)
                .mean(stats.mean())
                .pl(stats.plPercentage())
                .mps(stats.mps())
                .hso(stats.hso())
                .lso(stats.lso())
                .build();
    }

    record SectionSample(Section section, int totalStudents, List<Scan> scans) {

        DistributionTable distribution(ReportContext context) {
            DistributionTable table = new DistributionTable(context.topScore());
            for (Scan scan : scans) {
                if (scan.grading() != null && scan.grading().score() != null) {
                    table.add(scan.grading().score().pointsEarned());
                }
            }
            return table;
        }

        ItemTally tally(ReportContext context) {
            ItemTally tally = new ItemTally(context.answerKey());
            for (Scan scan : scans) {
                if (scan.hasDetection()) {
                    tally.record(scan.detection());
                }
            }
            return tally;
        }

        int scoredCount() {
            return (int) scans.stream().filter(scan -> scan.grading() != null).count();
        }
    }
}
