package nlfsm;

import java.util.List;
import java.util.Objects;

/** Transition action. Delays only exist until desugaring turns them into timer states. */
public sealed interface Action permits Action.Command, Action.Delay, Action.Notify {

  String kind();

  record Command(String device, String command, List<Literal> args) implements Action {
    public Command {
      Names.requireIdentifier(device, "Command device");
      Names.requireIdentifier(command, "Command name");
      args = args == null ? List.of() : List.copyOf(args);
    }

    public Command(String device, String command) {
      this(device, command, List.of());
    }

    @Override
    public String kind() {
      return "command";
    }
  }

  record Delay(long seconds) implements Action {
    public Delay {
      if (seconds < 0) {
        throw new IllegalArgumentException("delay must not be negative: " + seconds);
      }
    }

    @Override
    public String kind() {
      return "delay";
    }
  }

  record Notify(String message) implements Action {
    public Notify {
      Objects.requireNonNull(message, "message");
    }

    @Override
    public String kind() {
      return "notify";
    }
  }
}
