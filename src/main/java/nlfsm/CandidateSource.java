package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;

/** Produces candidate IR JSON from a request, and revised candidates from validation feedback. */
public interface CandidateSource {

  JsonNode generate(String request);

  /**
   * @param attempt 1 for the first repair
   */
  JsonNode repair(JsonNode candidate, ValidationReport report, int attempt);
}
