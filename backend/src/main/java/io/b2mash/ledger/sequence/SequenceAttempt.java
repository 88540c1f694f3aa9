package io.b2mash.ledger.sequence;

/** Outcome of one reservation attempt in {@link DocumentNumberSequencer}. */
sealed interface SequenceAttempt {

  record Issued(String number) implements SequenceAttempt {}

  /** Another caller reserved {@code candidate} first. */
  record Retry(String candidate) implements SequenceAttempt {}

  record Exhausted(int attempts) implements SequenceAttempt {}
}
