package nlfsm;

import com.fasterxml.jackson.databind.JsonNode;

/** Turns a change request into patch JSON against the current canonical machine. */
public interface PatchSource {

  /** @see IrPatch for the patch format */
  JsonNode patch(String request, StateMachine current);
}
