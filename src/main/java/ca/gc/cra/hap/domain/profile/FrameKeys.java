package ca.gc.cra.hap.domain.profile;

/** Frame field names shared by the deploy-gate profiles. */
public final class FrameKeys {
  public static final String REPO = "repo";
  public static final String SHA = "sha";
  public static final String ENV = "env";
  public static final String PROFILE = "profile";
  public static final String PATH = "path";
  public static final String DISCLOSURE_HASH = "disclosure_hash";

  private FrameKeys() {
    // Utility
  }
}
