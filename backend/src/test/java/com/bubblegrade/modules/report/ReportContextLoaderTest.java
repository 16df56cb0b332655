package com.bubblegrade.modules.report;

import com.bubblegrade.exception.BusinessException;
import com.bubblegrade.exception.ResourceNotFoundException;
import com.bubblegrade.modules.exam.AnswerKeyStore;
import com.bubblegrade.modules.exam.Exam;
import com.bubblegrade.modules.exam.ExamRepository;
import com.bubblegrade.modules.grading.AnswerKey;
import com.bubblegrade.modules.grading.KeyedAnswer;
import com.bubblegrade.modules.roster.Grade;
import com.bubblegrade.modules.roster.GradeRepository;
import com.bubblegrade.modules.roster.SchoolClass;
import com.bubblegrade.modules.roster.SchoolClassRepository;
import com.bubblegrade.modules.roster.Section;
import com.bubblegrade.modules.roster.SectionRepository;
import com.bubblegrade.support.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReportContextLoaderTest {

    private static final UUID GRADE_ID = UUID.randomUUID();
    private static final UUID CLASS_ID = UUID.randomUUID();
    private static final UUID EXAM_ID = UUID.randomUUID();
    private static final UUID SECTION_ID = UUID.randomUUID();

    @Mock
    private GradeRepository gradeRepository;
    @Mock
    private SchoolClassRepository classRepository;
    @Mock
    private ExamRepository examRepository;
    @Mock
    private SectionRepository sectionRepository;
    @Mock
    private AnswerKeyStore answerKeyStore;

    @InjectMocks
    private ReportContextLoader loader;

    private SchoolClass schoolClass;
    private Exam exam;

    @BeforeEach
    void setUp() {
        schoolClass = SchoolClass.builder().id(CLASS_ID).name("Math 7").gradeId(GRADE_ID)
                .sectionIds(new HashSet<>(Set.of(SECTION_ID))).build();
        exam = Exam.builder().id(EXAM_ID).name("Quiz 1").templateId(Fixtures.TEMPLATE).classId(CLASS_ID)
                .answers("[]").createdBy("teacher-1").build();

        lenient().when(gradeRepository.findById(GRADE_ID))
                .thenReturn(Optional.of(Grade.builder().id(GRADE_ID).name("Grade 7").build()));
        lenient().when(classRepository.findById(CLASS_ID)).thenReturn(Optional.of(schoolClass));
        lenient().when(examRepository.findById(EXAM_ID)).thenReturn(Optional.of(exam));
        lenient().when(answerKeyStore.findByExamId(EXAM_ID)).thenReturn(Optional.of(Fixtures.twoQuestionKey(EXAM_ID)));
        lenient().when(sectionRepository.findByIdInAndIsActiveTrueOrderByNameAsc(any()))
                .thenReturn(List.of(Section.builder().id(SECTION_ID).code("SEC-A").build()));
    }

    @Test
    void loadsEverythingForAValidRequest() {
        ReportContext context = loader.load(GRADE_ID, CLASS_ID, EXAM_ID);

        assertThat(context.grade().getName()).isEqualTo("Grade 7");
        assertThat(context.sections()).extracting(Section::getId).containsExactly(SECTION_ID);
        assertThat(context.totalPoints()).isEqualTo(2.0);
        assertThat(context.topScore()).isEqualTo(2);
    }

    @Test
    void allParametersAreRequired() {
        assertThatThrownBy(() -> loader.load(GRADE_ID, null, EXAM_ID))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Missing required parameters: grade_id, class_id, exam_id");
    }

    @Test
    void unknownExamIsNotFound() {
        UUID other = UUID.randomUUID();
        when(examRepository.findById(other)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> loader.load(GRADE_ID, CLASS_ID, other))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void examMustBelongToTheClass() {
        exam.setClassId(UUID.randomUUID());

        assertThatThrownBy(() -> loader.load(GRADE_ID, CLASS_ID, EXAM_ID))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Selected exam does not belong to the selected class");
    }

    @Test
    void classMustBelongToTheGrade() {
        schoolClass.setGradeId(UUID.randomUUID());

        assertThatThrownBy(() -> loader.load(GRADE_ID, CLASS_ID, EXAM_ID))
                .isInstanceOf(BusinessException.class);
    }

    @Test
    void emptyKeyIsRejected() {
        when(answerKeyStore.findByExamId(EXAM_ID))
                .thenReturn(Optional.of(new AnswerKey(EXAM_ID, Fixtures.TEMPLATE, List.of(), null)));

        assertThatThrownBy(() -> loader.load(GRADE_ID, CLASS_ID, EXAM_ID))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Exam has no answer key defined");
    }

    @Test
    void keyWorthNothingIsRejected() {
        when(answerKeyStore.findByExamId(EXAM_ID)).thenReturn(Optional.of(
                new AnswerKey(EXAM_ID, Fixtures.TEMPLATE, List.of(new KeyedAnswer(1, "A", 0.0)), null)));

        assertThatThrownBy(() -> loader.load(GRADE_ID, CLASS_ID, EXAM_ID))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Exam has no total points defined");
    }

    @Test
    void classWithoutSectionsIsRejected() {
        schoolClass.setSectionIds(new HashSet<>());

        assertThatThrownBy(() -> loader.load(GRADE_ID, CLASS_ID, EXAM_ID))
                .isInstanceOf(BusinessException.class)
                .hasMessage("Class has no sections defined");
    }

    @Test
    void classWithOnlyInactiveSectionsIsRejected() {
        when(sectionRepository.findByIdInAndIsActiveTrueOrderByNameAsc(any())).thenReturn(List.of());

        assertThatThrownBy(() -> loader.load(GRADE_ID, CLASS_ID, EXAM_ID))
                .isInstanceOf(BusinessException.class)
                .hasMessage("No active sections found for this class");
    }
}
