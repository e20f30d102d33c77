package io.github.brokerbench.publisher;

/**
 * Outcome of one publishing worker.
 *
 * @param workerId worker index, 0 is the leader
 * @param connected false if the worker could not connect and published nothing
 * @param published successful payload publishes
 * @param failed payload publishes that returned false
 */
public record WorkerResult(
  int workerId,
  boolean connected,
  long published,
  long failed
) {

  static WorkerResult connectFailed(int workerId) {
    return new WorkerResult(workerId, false, 0, 0);
  }
}
