package com.codeheadsystems.quire.server.store;

import com.codeheadsystems.quire.server.exception.DuplicateIdentityException;
import com.codeheadsystems.quire.server.exception.UnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialStore} that keeps one JSON document per account under
 * {@code <directory>/accounts/<sha256(identity)>.json}.
 * <p>
 * Writes run one at a time on a dedicated writer thread. A caller waits at most the configured
 * timeout for its write, queueing included, and gets {@link UnavailableException} after that;
 * a write still queued at that point is cancelled, one already touching the disk completes and
 * its result is discarded. A record is written to a temp file, forced to disk, then atomically
 * moved into place, so a crash leaves either the old state or the new one. Reads are served from
 * an in-memory index that is rebuilt from disk on construction.
 */
public class FileCredentialStore implements CredentialStore {

  private static final Logger log = LoggerFactory.getLogger(FileCredentialStore.class);

  static final String ACCOUNTS_DIRECTORY = "accounts";
  private static final String RECORD_SUFFIX = ".json";
  private static final String TEMP_SUFFIX = ".tmp";

  private final Path accountsDirectory;
  private final Duration operationTimeout;
  private final Clock clock;
  private final ObjectMapper mapper;
  private final ExecutorService writer;
  private final ConcurrentHashMap<String, Account> index = new ConcurrentHashMap<>();

  /**
   * Opens (creating if needed) a store rooted at {@code directory}.
   *
   * @param directory        the storage root
   * @param operationTimeout upper bound on a create or delete, queueing included
   * @param clock            the clock used to stamp {@link Account#createdAt()}
   * @throws IllegalStateException if the directory cannot be created or a record cannot be read
   */
  public FileCredentialStore(Path directory, Duration operationTimeout, Clock clock) {
    this(directory, operationTimeout, clock, null);
  }

  public FileCredentialStore(Path directory, Duration operationTimeout) {
    this(directory, operationTimeout, Clock.systemUTC());
  }

  FileCredentialStore(Path directory, Duration operationTimeout, Clock clock, ExecutorService writer) {
    this.accountsDirectory = Objects.requireNonNull(directory, "directory").resolve(ACCOUNTS_DIRECTORY);
    this.operationTimeout = Objects.requireNonNull(operationTimeout, "operationTimeout");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.mapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    try {
      Files.createDirectories(accountsDirectory);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot create credential store directory " + accountsDirectory, e);
    }
    loadIndex();
    this.writer = writer != null ? writer : Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "quire-credential-writer");
      t.setDaemon(true);
      return t;
    });
    log.info("FileCredentialStore({}) loaded {} account(s)", accountsDirectory, index.size());
  }

  @Override
  public Account create(String identity, String credentialHash, String displayName) {
    Account account = Account.newAccount(identity, credentialHash, displayName, clock);
    return await(() -> {
      if (index.containsKey(account.identity())) {
        log.debug("create: identity already registered");
        throw new DuplicateIdentityException();
      }
      write(recordPath(account.identity()), account);
      index.put(account.identity(), account);
      log.debug("Stored account {}", account.accountId());
      return account;
    });
  }

  @Override
  public Optional<Account> find(String identity) {
    return Optional.ofNullable(index.get(Identities.normalize(identity)));
  }

  @Override
  public boolean delete(String identity) {
    String normalized = Identities.normalize(identity);
    return await(() -> {
      if (!index.containsKey(normalized)) {
        return false;
      }
      try {
        Files.deleteIfExists(recordPath(normalized));
      } catch (IOException e) {
        log.error("Failed to delete account record", e);
        throw new UnavailableException(e);
      }
      index.remove(normalized);
      log.debug("Deleted account record");
      return true;
    });
  }

  @Override
  public long count() {
    return index.size();
  }

  @Override
  public boolean isAvailable() {
    return Files.isDirectory(accountsDirectory) && Files.isWritable(accountsDirectory);
  }

  /**
   * File name for an identity: the hex SHA-256 of its normalized UTF-8 bytes.
   *
   * @param normalizedIdentity the normalized identity
   * @return the file name stem
   */
  static String recordKey(String normalizedIdentity) {
    byte[] input = normalizedIdentity.getBytes(StandardCharsets.UTF_8);
    SHA256Digest digest = new SHA256Digest();
    digest.update(input, 0, input.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(out);
  }

  private Path recordPath(String normalizedIdentity) {
    return accountsDirectory.resolve(recordKey(normalizedIdentity) + RECORD_SUFFIX);
  }

  private <T> T await(Callable<T> operation) {
    Future<T> future;
    try {
      future = writer.submit(operation);
    } catch (RejectedExecutionException e) {
      throw new UnavailableException(e);
    }
    try {
      return future.get(operationTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(false);
      log.warn("Credential store operation timed out after {} ms", operationTimeout.toMillis());
      throw new UnavailableException(e);
    } catch (InterruptedException e) {
      future.cancel(false);
      Thread.currentThread().interrupt();
      throw new UnavailableException(e);
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new UnavailableException(e.getCause());
    }
  }

  private void write(Path target, Account account) {
    Path temp = null;
    try {
      byte[] bytes = mapper.writeValueAsBytes(account);
      temp = Files.createTempFile(accountsDirectory, target.getFileName().toString(), TEMP_SUFFIX);
      try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE,
          StandardOpenOption.TRUNCATE_EXISTING)) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      log.error("Failed to persist account record", e);
      deleteQuietly(temp);
      throw new UnavailableException(e);
    }
  }

  private void deleteQuietly(Path temp) {
    if (temp == null) {
      return;
    }
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not remove temp file {}", temp.getFileName(), e);
    }
  }

  private void loadIndex() {
    try (DirectoryStream<Path> files = Files.newDirectoryStream(accountsDirectory)) {
      for (Path file : files) {
        String name = file.getFileName().toString();
        if (name.endsWith(TEMP_SUFFIX)) {
          // Left behind by a write that never reached its rename.
          log.warn("Removing incomplete account record {}", name);
          Files.deleteIfExists(file);
          continue;
        }
        if (!name.endsWith(RECORD_SUFFIX)) {
          continue;
        }
        Account account = mapper.readValue(file.toFile(), Account.class);
        if (account.identity() == null || account.credentialHash() == null) {
          throw new IllegalStateException("Incomplete account record " + name);
        }
        if (!name.equals(recordKey(account.identity()) + RECORD_SUFFIX)) {
          throw new IllegalStateException("Account record " + name + " does not match its identity");
        }
        index.put(account.identity(), account);
      }
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read credential store directory " + accountsDirectory, e);
    }
  }
}
