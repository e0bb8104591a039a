package dev.depscout.exception;

/** Registry call failed for a reason other than the package not existing. */
public class PackageLookupException extends RuntimeException {
    private final String packageName;

    public PackageLookupException(String packageName, String message, Throwable cause) {
        super(message, cause);
        this.packageName = packageName;
    }

    public String getPackageName() {
        return packageName;
    }
}
