package com.flamingo.ai.pdfocr.artifact;

import com.flamingo.ai.pdfocr.config.OcrConfig;
import com.flamingo.ai.pdfocr.exception.ArtifactAlreadyExistsException;
import com.flamingo.ai.pdfocr.exception.ArtifactNotFoundException;
import com.flamingo.ai.pdfocr.exception.ArtifactStorageException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.Striped;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Artifact store on the local file system.
 *
 * <p>Layout under the base path:
 *
 * <pre>
 * {jobId}/input.pdf
 * {jobId}/pages/page-0001.png, page-0001.mmd, ...
 * {jobId}/output/output.mmd, output_det.mmd, output_layouts.pdf, images/*.jpg
 * </pre>
 *
 * <p>Outputs are written into a staging directory next to {@code output/} and moved into place
 * with a single atomic rename, so {@code output/} either holds the full set or does not exist.
 */
@Service
@Slf4j
public class FileSystemArtifactStore implements ArtifactStore {

  static final String INPUT_FILE = "input.pdf";
  static final String PAGES_DIR = "pages";
  static final String OUTPUT_DIR = "output";
  static final String STAGING_PREFIX = ".staging-";

  private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9][A-Za-z0-9_.-]*");

  private final Path basePath;
  private final Striped<Lock> writeLocks = Striped.lock(64);

  @Autowired
  public FileSystemArtifactStore(OcrConfig ocrConfig) {
    this(Path.of(ocrConfig.getStorage().getBasePath()));
  }

  @VisibleForTesting
  FileSystemArtifactStore(Path basePath) {
    this.basePath = basePath.toAbsolutePath().normalize();
    try {
      Files.createDirectories(this.basePath);
    } catch (IOException e) {
      throw new ArtifactStorageException(null, "Cannot create artifact root " + basePath, e);
    }
    log.info("Artifact store rooted at {}", this.basePath);
  }

  @Override
  public URI allocate(String jobId) {
    return locked(
        jobId,
        () -> {
          Path root = namespace(jobId);
          try {
            Files.createDirectory(root);
          } catch (FileAlreadyExistsException e) {
            throw new ArtifactAlreadyExistsException(jobId, "namespace");
          } catch (IOException e) {
            throw new ArtifactStorageException(jobId, "Cannot allocate namespace", e);
          }
          return root.toUri();
        });
  }

  @Override
  public void writeInput(String jobId, byte[] document) {
    locked(
        jobId,
        () -> {
          Path file = requireNamespace(jobId).resolve(INPUT_FILE);
          try {
            Files.write(file, document, StandardOpenOption.CREATE_NEW);
          } catch (FileAlreadyExistsException e) {
            throw new ArtifactAlreadyExistsException(jobId, INPUT_FILE);
          } catch (IOException e) {
            throw new ArtifactStorageException(jobId, "Cannot write input document", e);
          }
          return null;
        });
  }

  @Override
  public byte[] readInput(String jobId) {
    return read(jobId, requireNamespace(jobId).resolve(INPUT_FILE), INPUT_FILE);
  }

  @Override
  public void writePageImages(String jobId, List<BufferedImage> pages) {
    locked(
        jobId,
        () -> {
          Path dir = requireNamespace(jobId).resolve(PAGES_DIR);
          try {
            Files.createDirectories(dir);
            for (int i = 0; i < pages.size(); i++) {
              Path file = dir.resolve(pageFileName(i, "png"));
              if (!ImageIO.write(pages.get(i), "png", file.toFile())) {
                throw new IOException("No PNG writer available");
              }
            }
          } catch (IOException e) {
            throw new ArtifactStorageException(jobId, "Cannot write page images", e);
          }
          log.debug("Stored {} page images for job {}", pages.size(), jobId);
          return null;
        });
  }

  @Override
  public void writePageResult(String jobId, int pageIndex, String text) {
    locked(
        jobId,
        () -> {
          Path dir = requireNamespace(jobId).resolve(PAGES_DIR);
          try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(pageFileName(pageIndex, "mmd")), text);
          } catch (IOException e) {
            throw new ArtifactStorageException(jobId, "Cannot write page " + pageIndex, e);
          }
          return null;
        });
  }

  @Override
  public void writeOutputs(String jobId, OcrOutputs outputs) {
    locked(
        jobId,
        () -> {
          Path root = requireNamespace(jobId);
          Path output = root.resolve(OUTPUT_DIR);
          if (Files.exists(output)) {
            throw new ArtifactAlreadyExistsException(jobId, OUTPUT_DIR);
          }

          Path staging = root.resolve(STAGING_PREFIX + UUID.randomUUID());
          try {
            Path images = staging.resolve(ArtifactKind.IMAGES.getFileName());
            Files.createDirectories(images);
            writeArtifact(
                staging.resolve(ArtifactKind.MARKDOWN.getFileName()),
                outputs.markdown().getBytes(StandardCharsets.UTF_8));
            writeArtifact(
                staging.resolve(ArtifactKind.MARKDOWN_DET.getFileName()),
                outputs.annotatedMarkdown().getBytes(StandardCharsets.UTF_8));
            if (outputs.layoutPdf() != null) {
              writeArtifact(
                  staging.resolve(ArtifactKind.LAYOUT_PDF.getFileName()), outputs.layoutPdf());
            }
            for (Map.Entry<String, byte[]> image : outputs.images().entrySet()) {
              writeArtifact(images.resolve(safeName(jobId, image.getKey())), image.getValue());
            }
            Files.move(staging, output, StandardCopyOption.ATOMIC_MOVE);
          } catch (IOException e) {
            discardStaging(jobId, staging);
            throw new ArtifactStorageException(jobId, "Cannot publish outputs", e);
          } catch (RuntimeException e) {
            discardStaging(jobId, staging);
            throw e;
          }
          log.info(
              "Published outputs for job {} ({} images)", jobId, outputs.images().size());
          return null;
        });
  }

  /** Writes one staged output file. */
  protected void writeArtifact(Path file, byte[] content) throws IOException {
    Files.write(file, content, StandardOpenOption.CREATE_NEW);
  }

  @Override
  public boolean hasOutputs(String jobId) {
    return Files.isDirectory(namespace(jobId).resolve(OUTPUT_DIR));
  }

  @Override
  public byte[] readOutput(String jobId, ArtifactKind kind) {
    if (kind.isCollection()) {
      throw new ArtifactNotFoundException(jobId, kind.getPathName());
    }
    Path file = requireNamespace(jobId).resolve(OUTPUT_DIR).resolve(kind.getFileName());
    return read(jobId, file, kind.getPathName());
  }

  @Override
  public Set<String> listImages(String jobId) {
    Path dir =
        requireNamespace(jobId).resolve(OUTPUT_DIR).resolve(ArtifactKind.IMAGES.getFileName());
    if (!Files.isDirectory(dir)) {
      throw new ArtifactNotFoundException(jobId, ArtifactKind.IMAGES.getPathName());
    }
    try (Stream<Path> files = Files.list(dir)) {
      return files
          .map(path -> path.getFileName().toString())
          .collect(Collectors.toCollection(TreeSet::new));
    } catch (IOException e) {
      throw new ArtifactStorageException(jobId, "Cannot list images", e);
    }
  }

  @Override
  public byte[] readImage(String jobId, String imageName) {
    Path dir =
        requireNamespace(jobId).resolve(OUTPUT_DIR).resolve(ArtifactKind.IMAGES.getFileName());
    if (!SAFE_NAME.matcher(imageName).matches()) {
      throw new ArtifactNotFoundException(jobId, imageName);
    }
    return read(jobId, dir.resolve(imageName), imageName);
  }

  @Override
  public void remove(String jobId) {
    locked(
        jobId,
        () -> {
          try {
            if (FileSystemUtils.deleteRecursively(namespace(jobId))) {
              log.debug("Removed artifacts of job {}", jobId);
            }
          } catch (IOException e) {
            throw new ArtifactStorageException(jobId, "Cannot remove artifacts", e);
          }
          return null;
        });
  }

  @Override
  public Set<String> listNamespaces() {
    try (Stream<Path> dirs = Files.list(basePath)) {
      return dirs.filter(Files::isDirectory)
          .map(path -> path.getFileName().toString())
          .collect(Collectors.toCollection(TreeSet::new));
    } catch (IOException e) {
      throw new ArtifactStorageException(null, "Cannot list artifact namespaces", e);
    }
  }

  private Path namespace(String jobId) {
    return basePath.resolve(safeName(jobId, jobId));
  }

  private Path requireNamespace(String jobId) {
    Path root = namespace(jobId);
    if (!Files.isDirectory(root)) {
      throw new ArtifactNotFoundException(jobId, "namespace");
    }
    return root;
  }

  private String safeName(String jobId, String name) {
    if (name == null || !SAFE_NAME.matcher(name).matches()) {
      throw new ArtifactNotFoundException(jobId, String.valueOf(name));
    }
    return name;
  }

  private byte[] read(String jobId, Path file, String artifact) {
    try {
      return Files.readAllBytes(file);
    } catch (NoSuchFileException e) {
      throw new ArtifactNotFoundException(jobId, artifact);
    } catch (IOException e) {
      throw new ArtifactStorageException(jobId, "Cannot read " + artifact, e);
    }
  }

  private void discardStaging(String jobId, Path staging) {
    try {
      FileSystemUtils.deleteRecursively(staging);
    } catch (IOException cleanupError) {
      log.warn(
          "Could not remove staging directory {} for job {}: {}",
          staging,
          jobId,
          cleanupError.getMessage());
    }
  }

  private static String pageFileName(int pageIndex, String extension) {
    return String.format("page-%04d.%s", pageIndex + 1, extension);
  }

  private <T> T locked(String jobId, Supplier<T> action) {
    Lock lock = writeLocks.get(jobId);
    lock.lock();
    try {
      return action.get();
    } finally {
      lock.unlock();
    }
  }
}
