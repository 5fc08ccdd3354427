package io.tenderbridge.backend.qa;

import io.tenderbridge.backend.event.QuestionAnsweredEvent;
import io.tenderbridge.backend.event.QuestionAskedEvent;
import io.tenderbridge.backend.exception.ForbiddenException;
import io.tenderbridge.backend.exception.InvalidStateException;
import io.tenderbridge.backend.exception.ResourceNotFoundException;
import io.tenderbridge.backend.security.Actor;
import io.tenderbridge.backend.tender.Tender;
import io.tenderbridge.backend.tender.TenderRepository;
import io.tenderbridge.backend.tender.TenderStateMachine;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Clarification Q&A on tenders. Anyone signed in may ask while the tender is published or open;
 * members of the owning company answer, once per question.
 */
@Service
public class TenderQaService {

  private static final Logger log = LoggerFactory.getLogger(TenderQaService.class);

  private final TenderQuestionRepository questionRepository;
  private final TenderAnswerRepository answerRepository;
  private final TenderRepository tenderRepository;
  private final ApplicationEventPublisher eventPublisher;
  private final Clock clock;

  public TenderQaService(
      TenderQuestionRepository questionRepository,
      TenderAnswerRepository answerRepository,
      TenderRepository tenderRepository,
      ApplicationEventPublisher eventPublisher,
      Clock clock) {
    this.questionRepository = questionRepository;
    this.answerRepository = answerRepository;
    this.tenderRepository = tenderRepository;
    this.eventPublisher = eventPublisher;
    this.clock = clock;
  }

  @Transactional
  public TenderQuestion askQuestion(UUID tenderId, Actor actor, String text) {
    var tender = loadTender(tenderId);
    if (!TenderStateMachine.canReceiveQuestions(tender.getStatus())) {
      throw new InvalidStateException(
          "Tender not accepting questions",
          "Tender is '%s'. Questions are only accepted while it is 'published' or 'open'."
              .formatted(tender.getStatus().value()));
    }

    var now = now();
    var question =
        questionRepository.save(
            new TenderQuestion(tenderId, actor.userId(), actor.companyId(), text.trim(), now));

    eventPublisher.publishEvent(
        new QuestionAskedEvent(
            question.getId(),
            tenderId,
            tender.getTitle(),
            tender.getOwnerCompanyId(),
            actor.userId(),
            now));
    log.info("Question {} asked on tender {} by {}", question.getId(), tenderId, actor.userId());
    return question;
  }

  /** Newest first. */
  @Transactional(readOnly = true)
  public List<QuestionThread> listQuestions(UUID tenderId, boolean includeAnswers) {
    loadTender(tenderId);
    var questions = questionRepository.findByTenderIdOrderByAskedAtDesc(tenderId);
    if (!includeAnswers || questions.isEmpty()) {
      return questions.stream().map(q -> new QuestionThread(q, null)).toList();
    }

    var answers =
        answerRepository
            .findByQuestionIdIn(questions.stream().map(TenderQuestion::getId).toList())
            .stream()
            .collect(Collectors.toMap(TenderAnswer::getQuestionId, Function.identity()));
    return questions.stream().map(q -> new QuestionThread(q, answers.get(q.getId()))).toList();
  }

  @Transactional(readOnly = true)
  public QuestionThread getQuestion(UUID questionId) {
    var question =
        questionRepository
            .findById(questionId)
            .orElseThrow(() -> new ResourceNotFoundException("Question", questionId));
    return new QuestionThread(question, answerRepository.findByQuestionId(questionId).orElse(null));
  }

  @Transactional
  public TenderAnswer answerQuestion(UUID questionId, Actor actor, String text) {
    var question = lockQuestion(questionId);
    var tender = loadTender(question.getTenderId());
    if (!tender.getOwnerCompanyId().equals(actor.companyId())) {
      throw new ForbiddenException(
          "Not authorized",
          "Only members of the company that posted the tender can answer its questions");
    }
    if (question.isAnswered()) {
      throw new InvalidStateException(
          "Question already answered",
          "Question has already been answered; update the existing answer instead");
    }

    var now = now();
    var answer =
        answerRepository.save(new TenderAnswer(questionId, actor.userId(), text.trim(), now));
    question.markAnswered();
    questionRepository.save(question);

    eventPublisher.publishEvent(
        new QuestionAnsweredEvent(
            questionId,
            tender.getId(),
            tender.getTitle(),
            question.getAskedById(),
            question.getAskedByCompanyId(),
            actor.userId(),
            now));
    log.info("Question {} on tender {} answered by {}", questionId, tender.getId(), actor.userId());
    return answer;
  }

  @Transactional
  public TenderAnswer updateAnswer(UUID questionId, UUID answerId, Actor actor, String text) {
    var answer =
        answerRepository
            .findByIdAndQuestionId(answerId, questionId)
            .orElseThrow(() -> new ResourceNotFoundException("Answer", answerId));
    if (!answer.isAnsweredBy(actor.userId())) {
      throw new ForbiddenException("Not authorized", "You can only update your own answers");
    }
    answer.revise(text.trim());
    return answerRepository.save(answer);
  }

  /** Askers may withdraw their own question until it is answered. */
  @Transactional
  public void deleteQuestion(UUID questionId, Actor actor) {
    var question = lockQuestion(questionId);
    if (!question.isAskedBy(actor.userId())) {
      throw new ForbiddenException("Not authorized", "You can only delete your own questions");
    }
    if (question.isAnswered()) {
      throw new InvalidStateException(
          "Question already answered", "Answered questions cannot be deleted");
    }
    questionRepository.delete(question);
    log.info("Question {} on tender {} deleted by its asker", questionId, question.getTenderId());
  }

  private TenderQuestion lockQuestion(UUID questionId) {
    return questionRepository
        .findByIdForUpdate(questionId)
        .orElseThrow(() -> new ResourceNotFoundException("Question", questionId));
  }

  private Tender loadTender(UUID tenderId) {
    return tenderRepository
        .findById(tenderId)
        .orElseThrow(() -> new ResourceNotFoundException("Tender", tenderId));
  }

  private Instant now() {
    return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
  }
}
