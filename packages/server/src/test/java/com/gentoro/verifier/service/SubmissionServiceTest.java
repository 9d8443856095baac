package com.gentoro.verifier.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.gentoro.verifier.chain.ChainAdapter;
import com.gentoro.verifier.chain.ChainJobDetails;
import com.gentoro.verifier.chain.JobReference;
import com.gentoro.verifier.exception.StateException;
import com.gentoro.verifier.exception.ValidationException;
import com.gentoro.verifier.inference.InferenceClient;
import com.gentoro.verifier.jobs.InMemoryJobStore;
import com.gentoro.verifier.jobs.JobManager;
import com.gentoro.verifier.jobs.JobRecord;
import com.gentoro.verifier.jobs.JobStatus;
import com.gentoro.verifier.jobs.JobType;
import com.gentoro.verifier.pipeline.CrossValidationHandler;
import com.gentoro.verifier.pipeline.CrossValidationRequest;
import com.gentoro.verifier.pipeline.CrossValidationResult;
import com.gentoro.verifier.pipeline.VerificationHandler;
import com.gentoro.verifier.pipeline.VerificationResult;
import com.gentoro.verifier.prompt.PromptRepository;
import com.gentoro.verifier.scoring.AiScoringAdapter;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SubmissionServiceTest {
  private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
  private final InMemoryJobStore store = new InMemoryJobStore();
  private final JobManager jobs =
      new JobManager(store, Executors.newSingleThreadExecutor(), clock);
  private final InferenceClient inference = mock(InferenceClient.class);
  private final ChainAdapter chain = mock(ChainAdapter.class);
  private final AiScoringAdapter scoring = new AiScoringAdapter(inference, new PromptRepository());
  private final SubmissionService service = new SubmissionService(jobs, 50, 400_000, "ollama", clock);

  @AfterEach
  void tearDown() {
    jobs.close();
  }

  private JobRecord awaitTerminal(String id) throws InterruptedException {
    long deadline = System.currentTimeMillis() + 5_000;
    while (System.currentTimeMillis() < deadline) {
      JobRecord r = jobs.find(id).orElseThrow();
      if (r.status().isTerminal()) return r;
      Thread.sleep(10);
    }
    fail("Job " + id + " did not finish");
    return null;
  }

  @Test
  void exactlyMinimumLengthIsAcceptedAndCompletes() throws Exception {
    CountDownLatch release = new CountDownLatch(1);
    when(inference.chat(anyString(), anyString()))
        .thenAnswer(
            inv -> {
              release.await(5, TimeUnit.SECONDS);
              return "YES";
            });
    jobs.register(JobType.VERIFICATION, new VerificationHandler(scoring));

    SubmissionReceipt receipt = service.submitVerification("a".repeat(50));

    assertEquals("processing", receipt.status());
    assertEquals("/verify/" + receipt.jobId(), receipt.statusUrl());
    assertEquals("ollama", receipt.provider());
    assertEquals(1_700_000_000L, receipt.timestamp());
    assertEquals(JobStatus.PROCESSING, jobs.find(receipt.jobId()).orElseThrow().status());

    release.countDown();
    JobRecord done = awaitTerminal(receipt.jobId());
    VerificationResult result = (VerificationResult) done.result();
    assertEquals("YES", result.verdict());
    assertEquals(1, result.wordCount());
    assertEquals(1, result.readingTimeMinutes());
  }

  @Test
  void belowMinimumIsRejectedWithoutAJob() {
    jobs.register(JobType.VERIFICATION, new VerificationHandler(scoring));

    ValidationException e =
        assertThrows(ValidationException.class, () -> service.submitVerification("a".repeat(49)));
    assertEquals("Job data too short. Minimum length is 50 characters.", e.getMessage());
    assertEquals(0, store.size());
    verifyNoInteractions(inference);
  }

  @Test
  void lengthCountsCodePointsNotUtf16Units() {
    jobs.register(JobType.VERIFICATION, new VerificationHandler(scoring));
    when(inference.chat(anyString(), anyString())).thenReturn("YES");
    String emoji = new String(Character.toChars(0x1F600));

    String shortText = "a".repeat(48) + emoji;
    assertEquals(50, shortText.length());
    assertThrows(ValidationException.class, () -> service.submitVerification(shortText));
    assertEquals(0, store.size());

    SubmissionService small = new SubmissionService(jobs, 5, 10, "ollama", clock);
    assertNotNull(small.submitVerification(emoji.repeat(10)).jobId());
    assertThrows(ValidationException.class, () -> small.submitVerification(emoji.repeat(11)));
  }

  @Test
  void aboveMaximumIsRejected() {
    SubmissionService small = new SubmissionService(jobs, 5, 10, "ollama", clock);
    assertThrows(ValidationException.class, () -> small.submitVerification("a".repeat(11)));
    assertThrows(ValidationException.class, () -> small.submitVerification(null));
    assertEquals(0, store.size());
  }

  @Test
  void crossValidationWithoutTransactionSkipsEventCheck() throws Exception {
    jobs.register(JobType.CROSS_VALIDATION, new CrossValidationHandler(chain, scoring));
    JobReference ref = JobReference.parse("0x2a");
    ChainJobDetails details =
        new ChainJobDetails(
            "0x00000000000000000000000000000000000000aa",
            BigInteger.valueOf(7),
            BigInteger.TEN,
            "Audit",
            1,
            BigInteger.ONE,
            BigInteger.TWO,
            BigInteger.valueOf(3),
            "0x" + "0".repeat(64),
            BigInteger.ZERO);
    when(chain.readJob(ref)).thenReturn(Optional.of(details));
    when(inference.chat(anyString(), anyString())).thenReturn("77");
    when(chain.writeScore(BigInteger.valueOf(7), null, 77)).thenReturn("0xabc");

    SubmissionReceipt receipt =
        service.submitCrossValidation(new CrossValidationRequest(ref, null, null));
    assertEquals("/validate/" + receipt.jobId(), receipt.statusUrl());
    assertNull(receipt.provider());

    JobRecord done = awaitTerminal(receipt.jobId());
    assertEquals(JobStatus.COMPLETED, done.status());
    CrossValidationResult result = (CrossValidationResult) done.result();
    assertFalse(result.eventFound());
    assertEquals(77, result.score());
    verify(chain, never()).logsForTransaction(anyString());
  }

  @Test
  void crossValidationUnavailableWithoutHandler() {
    assertFalse(service.isCrossValidationEnabled());
    assertThrows(
        StateException.class,
        () ->
            service.submitCrossValidation(
                new CrossValidationRequest(JobReference.parse("0x2a"), null, null)));
  }
}
