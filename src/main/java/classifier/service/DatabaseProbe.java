package classifier.service;

/**
 * Connectivity check used by the health endpoint.
 */
public interface DatabaseProbe {

  /**
   * Returns normally when the database answers; throws with the driver's error otherwise.
   */
  void ping();
}
