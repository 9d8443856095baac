package com.gentoro.verifier.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.verifier.exception.JobNotFoundException;
import com.gentoro.verifier.jobs.InMemoryJobStore;
import com.gentoro.verifier.jobs.JobFailure;
import com.gentoro.verifier.jobs.JobManager;
import com.gentoro.verifier.jobs.JobOutcome;
import com.gentoro.verifier.jobs.JobType;
import com.gentoro.verifier.pipeline.VerificationResult;
import com.gentoro.verifier.signing.ResponseSigner;
import com.gentoro.verifier.signing.SignatureResult;
import com.gentoro.verifier.signing.SigningEnvelope;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class StatusQueryServiceTest {
  private final Clock clock = Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC);
  private final InMemoryJobStore store = new InMemoryJobStore(clock);
  private final JobManager jobs = new JobManager(store, Executors.newSingleThreadExecutor(), clock);
  private final StatusQueryService unsigned = new StatusQueryService(jobs, new SigningEnvelope(null));

  @AfterEach
  void tearDown() {
    jobs.close();
  }

  @Test
  void processingRecordHasNoResultOrErrorFields() {
    store.create("p", JobType.VERIFICATION);
    Map<String, Object> payload = unsigned.get("p", null);

    assertEquals("p", payload.get("job_id"));
    assertEquals("verification", payload.get("type"));
    assertEquals("processing", payload.get("status"));
    assertEquals(1_700_000_000L, payload.get("created_at"));
    assertFalse(payload.containsKey("finished_at"));
    assertFalse(payload.containsKey("result"));
    assertFalse(payload.containsKey("error"));
  }

  @Test
  void completedRecordFlattensResult() {
    store.create("c", JobType.VERIFICATION);
    store.setTerminal("c", JobOutcome.completed(new VerificationResult("YES", 420, 2)));

    Map<String, Object> payload = unsigned.get("c", null);

    assertEquals("completed", payload.get("status"));
    assertEquals("YES", payload.get("result"));
    assertEquals(420, payload.get("word_count"));
    assertEquals(2, payload.get("reading_time_minutes"));
    assertEquals("2 minutes", payload.get("reading_time"));
    assertEquals(1_700_000_000L, payload.get("finished_at"));
  }

  @Test
  void failedRecordCarriesError() {
    store.create("f", JobType.CROSS_VALIDATION);
    store.setTerminal("f", JobOutcome.failed(new JobFailure("Event not found", null, null)));

    Map<String, Object> payload = unsigned.get("f", null);

    assertEquals("failed", payload.get("status"));
    assertEquals("Event not found", payload.get("error"));
    assertFalse(payload.containsKey("error_details"));
    assertFalse(payload.containsKey("job_details"));
  }

  @Test
  void unknownOrOtherTypeIsNotFound() {
    store.create("v", JobType.VERIFICATION);

    assertThrows(JobNotFoundException.class, () -> unsigned.get("missing", null));
    assertThrows(JobNotFoundException.class, () -> unsigned.get("v", JobType.CROSS_VALIDATION));
  }

  @Test
  void everyReadIsSignedAgain() {
    ResponseSigner signer = mock(ResponseSigner.class);
    when(signer.sign(any())).thenReturn(new SignatureResult("0xsig", "0xpub"));
    store.create("c", JobType.VERIFICATION);
    store.setTerminal("c", JobOutcome.completed(new VerificationResult("NO", 60, 1)));
    StatusQueryService service = new StatusQueryService(jobs, new SigningEnvelope(signer));

    Map<String, Object> first = service.get("c", JobType.VERIFICATION);
    Map<String, Object> second = service.get("c", JobType.VERIFICATION);

    assertEquals(first, second);
    assertEquals("0xsig", first.get("signature"));
    assertEquals("0xpub", first.get("public_key"));
    verify(signer, times(2)).sign(any());
  }
}
