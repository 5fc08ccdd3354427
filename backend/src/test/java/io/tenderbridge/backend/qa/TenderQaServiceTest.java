package io.tenderbridge.backend.qa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.tenderbridge.backend.event.QuestionAnsweredEvent;
import io.tenderbridge.backend.event.QuestionAskedEvent;
import io.tenderbridge.backend.exception.ForbiddenException;
import io.tenderbridge.backend.exception.InvalidStateException;
import io.tenderbridge.backend.exception.ResourceNotFoundException;
import io.tenderbridge.backend.security.Actor;
import io.tenderbridge.backend.security.Roles;
import io.tenderbridge.backend.tender.Tender;
import io.tenderbridge.backend.tender.TenderFixtures;
import io.tenderbridge.backend.tender.TenderRepository;
import io.tenderbridge.backend.tender.TenderStatus;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class TenderQaServiceTest {

  private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
  private static final UUID TENDER_ID = UUID.randomUUID();
  private static final UUID OWNER_COMPANY = UUID.randomUUID();
  private static final UUID BIDDER_COMPANY = UUID.randomUUID();

  @Mock private TenderQuestionRepository questionRepository;
  @Mock private TenderAnswerRepository answerRepository;
  @Mock private TenderRepository tenderRepository;
  @Mock private ApplicationEventPublisher eventPublisher;

  private TenderQaService service;
  private Actor bidder;
  private Actor ownerMember;

  @BeforeEach
  void setUp() {
    service =
        new TenderQaService(
            questionRepository,
            answerRepository,
            tenderRepository,
            eventPublisher,
            Clock.fixed(NOW, ZoneOffset.UTC));
    bidder = new Actor(UUID.randomUUID(), BIDDER_COMPANY, Roles.USER);
    ownerMember = new Actor(UUID.randomUUID(), OWNER_COMPANY, Roles.EVALUATOR);
  }

  private Tender stubTender(TenderStatus status) {
    var tender =
        TenderFixtures.tender(
            TENDER_ID, status, OWNER_COMPANY, NOW.plus(Duration.ofDays(7)), NOW);
    when(tenderRepository.findById(TENDER_ID)).thenReturn(Optional.of(tender));
    return tender;
  }

  private TenderQuestion stubQuestion(Actor asker) {
    var question = QaFixtures.question(TENDER_ID, asker, NOW);
    when(questionRepository.findByIdForUpdate(question.getId())).thenReturn(Optional.of(question));
    return question;
  }

  // --- ask ---

  @ParameterizedTest
  @EnumSource(
      value = TenderStatus.class,
      names = {"PUBLISHED", "OPEN"})
  void askQuestion_whilePublishedOrOpen_savesAndPublishes(TenderStatus status) {
    stubTender(status);
    when(questionRepository.save(any(TenderQuestion.class))).thenAnswer(inv -> inv.getArgument(0));

    var question = service.askQuestion(TENDER_ID, bidder, "  When is the site visit scheduled?  ");

    assertThat(question.getQuestionText()).isEqualTo("When is the site visit scheduled?");
    assertThat(question.getAskedById()).isEqualTo(bidder.userId());
    assertThat(question.getAskedByCompanyId()).isEqualTo(BIDDER_COMPANY);
    assertThat(question.getAskedAt()).isEqualTo(NOW);
    assertThat(question.isAnswered()).isFalse();

    var captor = ArgumentCaptor.forClass(QuestionAskedEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().ownerCompanyId()).isEqualTo(OWNER_COMPANY);
    assertThat(captor.getValue().tenderId()).isEqualTo(TENDER_ID);
  }

  @ParameterizedTest
  @EnumSource(
      value = TenderStatus.class,
      names = {"DRAFT", "EVALUATION", "CLOSED", "AWARDED", "CANCELLED"})
  void askQuestion_outsidePublishedOrOpen_throwsInvalidState(TenderStatus status) {
    stubTender(status);

    assertThatThrownBy(
            () -> service.askQuestion(TENDER_ID, bidder, "When is the site visit scheduled?"))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            ex -> assertThat(ex.getBody().getTitle()).isEqualTo("Tender not accepting questions"));
    verify(questionRepository, never()).save(any());
    verifyNoInteractions(eventPublisher);
  }

  @Test
  void askQuestion_unknownTender_throwsNotFound() {
    when(tenderRepository.findById(TENDER_ID)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.askQuestion(TENDER_ID, bidder, "Is there a site visit?"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  // --- answer ---

  @Test
  void answerQuestion_byOwningCompany_savesAnswerAndNotifiesAsker() {
    stubTender(TenderStatus.OPEN);
    var question = stubQuestion(bidder);
    when(answerRepository.save(any(TenderAnswer.class))).thenAnswer(inv -> inv.getArgument(0));

    var answer = service.answerQuestion(question.getId(), ownerMember, "Next Tuesday at 09:00.");

    assertThat(answer.getAnswerText()).isEqualTo("Next Tuesday at 09:00.");
    assertThat(answer.getAnsweredById()).isEqualTo(ownerMember.userId());
    assertThat(question.isAnswered()).isTrue();
    verify(questionRepository).save(question);

    var captor = ArgumentCaptor.forClass(QuestionAnsweredEvent.class);
    verify(eventPublisher).publishEvent(captor.capture());
    assertThat(captor.getValue().askedById()).isEqualTo(bidder.userId());
    assertThat(captor.getValue().askedByCompanyId()).isEqualTo(BIDDER_COMPANY);
  }

  @Test
  void answerQuestion_onClosedTender_isStillAllowed() {
    stubTender(TenderStatus.CLOSED);
    var question = stubQuestion(bidder);
    when(answerRepository.save(any(TenderAnswer.class))).thenAnswer(inv -> inv.getArgument(0));

    service.answerQuestion(question.getId(), ownerMember, "Yes, the deadline stands.");

    assertThat(question.isAnswered()).isTrue();
  }

  @Test
  void answerQuestion_byOtherCompany_throwsForbidden() {
    stubTender(TenderStatus.OPEN);
    var question = stubQuestion(bidder);

    assertThatThrownBy(
            () -> service.answerQuestion(question.getId(), bidder, "Answering my own question"))
        .isInstanceOf(ForbiddenException.class);
    verify(answerRepository, never()).save(any());
    assertThat(question.isAnswered()).isFalse();
  }

  @Test
  void answerQuestion_alreadyAnswered_throwsInvalidState() {
    stubTender(TenderStatus.OPEN);
    var question = stubQuestion(bidder);
    question.markAnswered();

    assertThatThrownBy(
            () -> service.answerQuestion(question.getId(), ownerMember, "A second answer text"))
        .isInstanceOfSatisfying(
            InvalidStateException.class,
            ex -> assertThat(ex.getBody().getTitle()).isEqualTo("Question already answered"));
    verify(answerRepository, never()).save(any());
  }

  // --- update answer ---

  @Test
  void updateAnswer_byAuthor_revisesText() {
    var answer = QaFixtures.answer(UUID.randomUUID(), ownerMember, NOW);
    when(answerRepository.findByIdAndQuestionId(answer.getId(), answer.getQuestionId()))
        .thenReturn(Optional.of(answer));
    when(answerRepository.save(answer)).thenReturn(answer);

    service.updateAnswer(
        answer.getQuestionId(), answer.getId(), ownerMember, "  Corrected: Wednesday.  ");

    assertThat(answer.getAnswerText()).isEqualTo("Corrected: Wednesday.");
  }

  @Test
  void updateAnswer_byColleagueOfAuthor_throwsForbidden() {
    var answer = QaFixtures.answer(UUID.randomUUID(), ownerMember, NOW);
    when(answerRepository.findByIdAndQuestionId(answer.getId(), answer.getQuestionId()))
        .thenReturn(Optional.of(answer));
    var colleague = new Actor(UUID.randomUUID(), OWNER_COMPANY, Roles.COMPANY_ADMIN);

    assertThatThrownBy(
            () ->
                service.updateAnswer(
                    answer.getQuestionId(), answer.getId(), colleague, "Overwriting the answer"))
        .isInstanceOf(ForbiddenException.class);
    verify(answerRepository, never()).save(any());
  }

  @Test
  void updateAnswer_answerOfOtherQuestion_throwsNotFound() {
    var questionId = UUID.randomUUID();
    var answerId = UUID.randomUUID();
    when(answerRepository.findByIdAndQuestionId(answerId, questionId))
        .thenReturn(Optional.empty());

    assertThatThrownBy(
            () -> service.updateAnswer(questionId, answerId, ownerMember, "Some new answer"))
        .isInstanceOf(ResourceNotFoundException.class);
  }

  // --- delete ---

  @Test
  void deleteQuestion_byAskerWhileUnanswered_deletes() {
    var question = stubQuestion(bidder);

    service.deleteQuestion(question.getId(), bidder);

    verify(questionRepository).delete(question);
  }

  @Test
  void deleteQuestion_byOtherUser_throwsForbidden() {
    var question = stubQuestion(bidder);

    assertThatThrownBy(() -> service.deleteQuestion(question.getId(), ownerMember))
        .isInstanceOf(ForbiddenException.class);
    verify(questionRepository, never()).delete(any());
  }

  @Test
  void deleteQuestion_answered_throwsInvalidState() {
    var question = stubQuestion(bidder);
    question.markAnswered();

    assertThatThrownBy(() -> service.deleteQuestion(question.getId(), bidder))
        .isInstanceOf(InvalidStateException.class);
    verify(questionRepository, never()).delete(any());
  }

  // --- list ---

  @Test
  void listQuestions_attachesEachAnswerToItsQuestion() {
    stubTender(TenderStatus.OPEN);
    var answeredQuestion = QaFixtures.question(TENDER_ID, bidder, NOW);
    var openQuestion = QaFixtures.question(TENDER_ID, bidder, NOW);
    var answer = QaFixtures.answer(answeredQuestion.getId(), ownerMember, NOW);
    when(questionRepository.findByTenderIdOrderByAskedAtDesc(TENDER_ID))
        .thenReturn(List.of(openQuestion, answeredQuestion));
    when(answerRepository.findByQuestionIdIn(anyCollection())).thenReturn(List.of(answer));

    var threads = service.listQuestions(TENDER_ID, true);

    assertThat(threads).extracting(QuestionThread::question)
        .containsExactly(openQuestion, answeredQuestion);
    assertThat(threads.get(0).answer()).isNull();
    assertThat(threads.get(1).answer()).isSameAs(answer);
  }

  @Test
  void listQuestions_withoutAnswers_skipsAnswerLookup() {
    stubTender(TenderStatus.OPEN);
    when(questionRepository.findByTenderIdOrderByAskedAtDesc(TENDER_ID))
        .thenReturn(List.of(QaFixtures.question(TENDER_ID, bidder, NOW)));

    var threads = service.listQuestions(TENDER_ID, false);

    assertThat(threads).singleElement().extracting(QuestionThread::answer).isNull();
    verifyNoInteractions(answerRepository);
  }
}
