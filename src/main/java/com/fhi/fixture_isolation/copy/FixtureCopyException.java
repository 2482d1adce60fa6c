package com.fhi.fixture_isolation.copy;

/**
 * Thrown when a fixture value graph cannot be deep-copied.
 */
public class FixtureCopyException extends RuntimeException
{
    private final Class<?> type;

    public FixtureCopyException(Class<?> type, String message, Throwable cause)
    {   super(String.format("Cannot copy value of type %s: %s", type.getName(), message), cause);
        this.type = type;
    }

    /**
     * The type whose instance could not be copied.
     */
    public Class<?> getType()
    {   return type;
    }

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
}
