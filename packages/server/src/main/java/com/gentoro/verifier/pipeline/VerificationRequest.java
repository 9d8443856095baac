package com.gentoro.verifier.pipeline;

/** Free text submitted for a dispute verdict. Length is checked before the job is created. */
public record VerificationRequest(String text) {}
