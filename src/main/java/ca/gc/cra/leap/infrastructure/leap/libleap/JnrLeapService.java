package ca.gc.cra.leap.infrastructure.leap.libleap;

import ca.gc.cra.leap.application.port.EventDispatcher;
import ca.gc.cra.leap.application.port.LeapException;
import ca.gc.cra.leap.application.port.LeapService;
import ca.gc.cra.leap.application.port.LeapSession;
import java.util.Objects;
import jnr.ffi.Runtime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LeapService} backed by the {@code LeapShim} native library through JNR-FFI.
 *
 * <p>The library is loaded on the first {@link #open(EventDispatcher)} and reused by later sessions.</p>
 *
 * @since 0.1.0
 */
public final class JnrLeapService implements LeapService {
  /** Default shim library name. */
  public static final String DEFAULT_LIBRARY = "LeapShim";

  private static final Logger log = LoggerFactory.getLogger(JnrLeapService.class);

  private final String libraryName;
  private JnrLeapLibrary library;
  private Runtime runtime;

  public JnrLeapService() {
    this(DEFAULT_LIBRARY);
  }

  /**
   * Creates a service that loads the named shim library.
   *
   * @param libraryName library name without platform prefix or suffix
   */
  public JnrLeapService(String libraryName) {
    this.libraryName = (libraryName == null || libraryName.isBlank()) ? DEFAULT_LIBRARY : libraryName;
  }

  JnrLeapService(JnrLeapLibrary library, Runtime runtime) {
    this.libraryName = DEFAULT_LIBRARY;
    this.library = Objects.requireNonNull(library, "library");
    this.runtime = Objects.requireNonNull(runtime, "runtime");
  }

  @Override
  public LeapSession open(EventDispatcher dispatcher) throws LeapException {
    Objects.requireNonNull(dispatcher, "dispatcher");
    JnrLeapLibrary lib;
    Runtime rt;
    synchronized (this) {
      if (library == null) {
        library = JnrLeapLibrary.load(libraryName);
        runtime = Runtime.getRuntime(library);
        log.info("Loaded native library {}", libraryName);
      }
      lib = library;
      rt = runtime;
    }
    JnrLeapSession session = new JnrLeapSession(lib, rt, dispatcher);
    log.info("Opened native tracking session");
    return session;
  }

  public String libraryName() {
    return libraryName;
  }
}
