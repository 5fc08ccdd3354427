package io.tenderbridge.backend.qa;

import io.tenderbridge.backend.security.ActorResolver;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class TenderQaController {

  private final TenderQaService qaService;

  public TenderQaController(TenderQaService qaService) {
    this.qaService = qaService;
  }

  @PostMapping("/api/tenders/{tenderId}/questions")
  public ResponseEntity<QuestionResponse> askQuestion(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID tenderId,
      @Valid @RequestBody QuestionRequest request) {
    var question = qaService.askQuestion(tenderId, ActorResolver.fromJwt(jwt), request.text());
    return ResponseEntity.created(URI.create("/api/questions/" + question.getId()))
        .body(QuestionResponse.from(new QuestionThread(question, null)));
  }

  @GetMapping("/api/tenders/{tenderId}/questions")
  public ResponseEntity<List<QuestionResponse>> listQuestions(
      @PathVariable UUID tenderId, @RequestParam(defaultValue = "true") boolean includeAnswers) {
    var threads = qaService.listQuestions(tenderId, includeAnswers);
    return ResponseEntity.ok(threads.stream().map(QuestionResponse::from).toList());
  }

  @GetMapping("/api/questions/{id}")
  public ResponseEntity<QuestionResponse> getQuestion(@PathVariable UUID id) {
    return ResponseEntity.ok(QuestionResponse.from(qaService.getQuestion(id)));
  }

  @PostMapping("/api/questions/{id}/answer")
  public ResponseEntity<AnswerResponse> answerQuestion(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @Valid @RequestBody AnswerRequest request) {
    var answer = qaService.answerQuestion(id, ActorResolver.fromJwt(jwt), request.text());
    return ResponseEntity.created(URI.create("/api/questions/" + id))
        .body(AnswerResponse.from(answer));
  }

  @PutMapping("/api/questions/{id}/answer/{answerId}")
  public ResponseEntity<AnswerResponse> updateAnswer(
      @AuthenticationPrincipal Jwt jwt,
      @PathVariable UUID id,
      @PathVariable UUID answerId,
      @Valid @RequestBody AnswerRequest request) {
    var answer = qaService.updateAnswer(id, answerId, ActorResolver.fromJwt(jwt), request.text());
    return ResponseEntity.ok(AnswerResponse.from(answer));
  }

  @DeleteMapping("/api/questions/{id}")
  public ResponseEntity<Void> deleteQuestion(
      @AuthenticationPrincipal Jwt jwt, @PathVariable UUID id) {
    qaService.deleteQuestion(id, ActorResolver.fromJwt(jwt));
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record QuestionRequest(
      @NotBlank @Size(min = 10, max = 2000, message = "question must be 10-2000 characters")
          String text) {}

  public record AnswerRequest(
      @NotBlank @Size(min = 10, max = 5000, message = "answer must be 10-5000 characters")
          String text) {}

  public record QuestionResponse(
      UUID id,
      UUID tenderId,
      UUID askedById,
      UUID askedByCompanyId,
      String text,
      boolean answered,
      Instant askedAt,
      AnswerResponse answer) {

    public static QuestionResponse from(QuestionThread thread) {
      var question = thread.question();
      return new QuestionResponse(
          question.getId(),
          question.getTenderId(),
          question.getAskedById(),
          question.getAskedByCompanyId(),
          question.getQuestionText(),
          question.isAnswered(),
          question.getAskedAt(),
          thread.answer() == null ? null : AnswerResponse.from(thread.answer()));
    }
  }

  public record AnswerResponse(
      UUID id,
      UUID questionId,
      UUID answeredById,
      String text,
      Instant answeredAt,
      Instant updatedAt) {

    public static AnswerResponse from(TenderAnswer answer) {
      return new AnswerResponse(
          answer.getId(),
          answer.getQuestionId(),
          answer.getAnsweredById(),
          answer.getAnswerText(),
          answer.getAnsweredAt(),
          answer.getUpdatedAt());
    }
  }
}
