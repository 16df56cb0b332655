package com.bubblegrade.modules.report;

import com.bubblegrade.exception.BusinessException;
import com.bubblegrade.exception.ResourceNotFoundException;
import com.bubblegrade.modules.exam.AnswerKeyStore;
import com.bubblegrade.modules.exam.Exam;
import com.bubblegrade.modules.exam.ExamRepository;
import com.bubblegrade.modules.grading.AnswerKey;
import com.bubblegrade.modules.roster.Grade;
import com.bubblegrade.modules.roster.GradeRepository;
import com.bubblegrade.modules.roster.SchoolClass;
import com.bubblegrade.modules.roster.SchoolClassRepository;
import com.bubblegrade.modules.roster.Section;
import com.bubblegrade.modules.roster.SectionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class ReportContextLoader {

    private final GradeRepository gradeRepository;
    private final SchoolClassRepository classRepository;
    private final ExamRepository examRepository;
    private final SectionRepository sectionRepository;
    private final AnswerKeyStore answerKeyStore;

    /**
     * Validates the report parameters and loads what they point to.
     *
     * @throws BusinessException         for missing or inconsistent parameters
     * @throws ResourceNotFoundException when the grade, class or exam does not exist
     */
    @Transactional(readOnly = true)
    public ReportContext load(UUID gradeId, UUID classId, UUID examId) {
        if (gradeId == null || classId == null || examId == null) {
            throw new BusinessException("Missing required parameters: grade_id, class_id, exam_id");
        }

        Grade grade = gradeRepository.findById(gradeId)
                .orElseThrow(() -> new ResourceNotFoundException("Grade", gradeId.toString()));
        SchoolClass schoolClass = classRepository.findById(classId)
                .orElseThrow(() -> new ResourceNotFoundException("Class", classId.toString()));
        Exam exam = examRepository.findById(examId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam", examId.toString()));

        if (schoolClass.getGradeId() != null && !schoolClass.getGradeId().equals(gradeId)) {
            throw new BusinessException("Selected class does not belong to the selected grade");
        }
        if (exam.getClassId() != null && !exam.getClassId().equals(classId)) {
            throw new BusinessException("Selected exam does not belong to the selected class");
        }

        AnswerKey answerKey = answerKeyStore.findByExamId(examId)
                .orElseThrow(() -> new ResourceNotFoundException("Exam", examId.toString()));
        if (answerKey.isEmpty()) {
            throw new BusinessException("Exam has no answer key defined");
        }
        if (answerKey.totalPoints() <= 0) {
            throw new BusinessException("Exam has no total points defined");
        }

        if (schoolClass.getSectionIds() == null || schoolClass.getSectionIds().isEmpty()) {
            throw new BusinessException("Class has no sections defined");
        }
        List<Section> sections = sectionRepository.findByIdInAndIsActiveTrueOrderByNameAsc(
                schoolClass.getSectionIds());
        if (sections.isEmpty()) {
            throw new BusinessException("No active sections found for this class");
        }

        return new ReportContext(grade, schoolClass, exam, answerKey, sections);
    }
}
