package nlfsm;

/** Structural pass, then (only when it passes) the catalog pass. */
public final class IrValidator {

  private IrValidator() {}

  public static ValidationReport validate(StateMachine ir, ShapeSchema schema, Catalog catalog) {
    ValidationReport structural = new StructuralValidator(schema).validate(ir);
    if (!structural.ok()) {
      return structural;
    }
    return structural.plus(new DomainValidator(catalog).validate(ir));
  }
}
