package com.fhi.fixture_isolation.patch;

import java.util.List;

/**
 * Exception thrown when a patch is started, stopped or resolved in a way that breaks
 * the patch lifecycle.
 *
 * <p>Use static factory methods to build a meaningful {@code PatchException}
 * with a specific cause enum and a descriptive message.</p>
 *
 * <p>All of these are test authoring defects: they are never caught and recovered from
 * inside the library, since a silently half-applied patch would invalidate the isolation
 * of every test that runs afterwards.</p>
 */
public class PatchException extends RuntimeException
{
    /**
     * Enum representing the specific reason why the patch operation failed.
     */
   public enum Cause
   {
      DOUBLE_ACTIVATION       ("Patch on '%s' is already active"),
      INACTIVE_PATCH_STOP     ("Patch on '%s' is not active and cannot be stopped"),
      TARGET_NOT_FOUND        ("Patch target '%s' cannot be resolved: %s"),
      TARGET_NOT_PATCHABLE    ("Patch target '%s' is not patchable: %s"),
      INCOMPATIBLE_REPLACEMENT("Replacement of type %s cannot be assigned to patch target '%s' of type %s"),
      TARGET_CONFLICT         ("Target '%s' is already patched by another active patch of this registry"),
      UNKNOWN_PATCH           ("No patch registered under name '%s' (known: %s)"),
      UNBALANCED              ("%d patch(es) still active at the end of the test class: %s");

      private final String messageTemplate;

      Cause(String messageTemplate)
      {  this.messageTemplate = messageTemplate;
      }

      public String format(Object... args)
      {  return String.format(messageTemplate, args);
      }

      public String getCode()
      {   return this.name();
      }
   }

   private final Cause causeEnum;

   /**
    * Creates a new PatchException with a cause enum, message, and underlying exception.
    *
    * @param causeEnum a semantic reason from the {@code Cause} enum
    * @param message a human-readable description
    * @param cause the original exception that triggered this one (may be null)
    */
   public PatchException(Cause causeEnum, String message, Throwable cause)
   {   super(message, cause);
       this.causeEnum = causeEnum;
   }

    /**
     * Returns the reason for the failure.
     */
   public Cause getCauseEnum()
   {   return causeEnum;
   }

   /**
    * Same format as the other library exceptions:
    * <pre>
    * PatchException: Main error message | Caused by: CauseClass: Cause message
    * </pre>
    */
   @Override
   public String toString()
   {
      String errMsg = String.format("%s: %s", this.getClass().getSimpleName(), this.getMessage());
      Throwable cause = getCause();
      if (     cause != null && cause.getMessage() != null
            && !cause.getMessage().isBlank())
      {  errMsg += String.format(" | Caused by: %s: %s", cause.getClass().getSimpleName(), cause.getMessage());
      }
      return errMsg;
   }


    // -----------------------------------------
    // Static factory methods
    // -----------------------------------------

   public static PatchException doubleActivation(String target)
   {  return new PatchException(Cause.DOUBLE_ACTIVATION, Cause.DOUBLE_ACTIVATION.format(target), null);
   }

   public static PatchException inactivePatchStop(String target)
   {  return new PatchException(Cause.INACTIVE_PATCH_STOP, Cause.INACTIVE_PATCH_STOP.format(target), null);
   }

   /**
    * @param cause pass null if no Throwable cause.
    */
   public static PatchException targetNotFound(String target, String reason, Throwable cause)
   {  return new PatchException(Cause.TARGET_NOT_FOUND, Cause.TARGET_NOT_FOUND.format(target, reason), cause);
   }

   public static PatchException targetNotPatchable(String target, String reason)
   {  return new PatchException(Cause.TARGET_NOT_PATCHABLE, Cause.TARGET_NOT_PATCHABLE.format(target, reason), null);
   }

   /**
    * @param cause pass null if no Throwable cause.
    */
   public static PatchException incompatibleReplacement(String target, Class<?> fieldType, Object replacement, Throwable cause)
   {  String replacementType = replacement == null ? "null" : replacement.getClass().getName();
      return new PatchException(Cause.INCOMPATIBLE_REPLACEMENT,
                                Cause.INCOMPATIBLE_REPLACEMENT.format(replacementType, target, fieldType.getName()),
                                cause);
   }

   public static PatchException targetConflict(String target)
   {  return new PatchException(Cause.TARGET_CONFLICT, Cause.TARGET_CONFLICT.format(target), null);
   }

   public static PatchException unknownPatch(String name, Iterable<String> known)
   {  return new PatchException(Cause.UNKNOWN_PATCH, Cause.UNKNOWN_PATCH.format(name, known), null);
   }

   public static PatchException unbalanced(List<String> stillActive)
   {  return new PatchException(Cause.UNBALANCED, Cause.UNBALANCED.format(stillActive.size(), stillActive), null);
   }
}
