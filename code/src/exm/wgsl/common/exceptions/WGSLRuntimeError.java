package exm.wgsl.common.exceptions;

/**
 * This represents an internal error or a violated precondition.
 * These always indicate a bug in the caller (or a missing feature),
 * never a condition to recover from.
 * @author wozniak
 * */
public class WGSLRuntimeError extends RuntimeException
{
  public WGSLRuntimeError(String msg)
  {
    super(msg);
  }

  public WGSLRuntimeError(String msg, Throwable cause)
  {
    super(msg, cause);
  }

  private static final long serialVersionUID = 1L;
}
