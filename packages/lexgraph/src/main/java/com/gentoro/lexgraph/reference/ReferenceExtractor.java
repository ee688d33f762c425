package com.gentoro.lexgraph.reference;

import com.gentoro.lexgraph.exception.LexGraphErrorCode;
import com.gentoro.lexgraph.exception.LexGraphException;
import com.gentoro.lexgraph.model.StructuralUnit;
import com.gentoro.lexgraph.model.UnitTree;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds citation-shaped phrases in unit text and resolves them against the document's citation
 * index.
 *
 * <p>Every pattern of {@link ReferencePattern#PRIORITY_ORDER} is applied to the text. Candidate
 * matches are then accepted by priority, then by position; a match that overlaps an accepted one
 * is dropped, so "except as provided in section 274" yields one exception reference and no general
 * one. Accepted references are returned in text order.
 *
 * <p>Section numbers are qualified with the title enclosing the source unit, or with the title a
 * trailing "of title X" names when the document holds it. Targets missing from the document and
 * phrases pointing into another title or Act are reported as {@link
 * ReferenceResolutionWarning}s. Self-references are dropped silently. Only units whose status is
 * operative are scanned.
 */
public class ReferenceExtractor {
  private static final org.slf4j.Logger log =
      com.gentoro.lexgraph.logging.LoggingService.getLogger(ReferenceExtractor.class);

  public static final int DEFAULT_CONTEXT_WINDOW = 200;

  /** "... of title 42", "... of the Social Security Act", "... of such Act". */
  private static final Pattern EXTERNAL_SUFFIX =
      Pattern.compile(
          "^\\s*,?\\s*of\\s+(?:title\\s+(\\d+[A-Za-z]?)\\b"
              + "|such\\s+Act\\b"
              + "|the\\s+[^.;]{0,120}?\\bAct\\b)",
          Pattern.CASE_INSENSITIVE);

  private final List<ReferencePattern> patterns;
  private final int contextWindow;
  private final int parallelism;

  public ReferenceExtractor() {
    this(DEFAULT_CONTEXT_WINDOW, 1);
  }

  /**
   * @param contextWindow maximum length of the context stored with each reference
   * @param parallelism number of worker threads for {@link #extractAll(UnitTree)}; 1 runs inline
   */
  public ReferenceExtractor(int contextWindow, int parallelism) {
    this(ReferencePattern.PRIORITY_ORDER, contextWindow, parallelism);
  }

  ReferenceExtractor(List<ReferencePattern> patterns, int contextWindow, int parallelism) {
    if (contextWindow <= 0) {
      throw new IllegalArgumentException("Context window must be positive: " + contextWindow);
    }
    this.patterns = List.copyOf(patterns);
    this.contextWindow = contextWindow;
    this.parallelism = Math.max(1, parallelism);
  }

  /** Scans every unit of the tree; results are in document order whatever the parallelism. */
  public ExtractionResult extractAll(UnitTree tree) {
    List<StructuralUnit> units = tree.units();
    ExtractionResult result;
    if (parallelism == 1 || units.size() < 2) {
      List<ExtractionResult> parts = new ArrayList<>(units.size());
      for (StructuralUnit unit : units) {
        parts.add(extract(unit, tree));
      }
      result = ExtractionResult.merge(parts);
    } else {
      result = extractInParallel(tree, units);
    }
    log.info(
        "Extracted {} references from {} units ({} phrases not resolved)",
        result.size(),
        units.size(),
        result.warnings().size());
    return result;
  }

  private ExtractionResult extractInParallel(UnitTree tree, List<StructuralUnit> units) {
    AtomicInteger threadIds = new AtomicInteger();
    ExecutorService pool =
        new ThreadPoolExecutor(
            parallelism,
            parallelism,
            0L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            r -> {
              Thread t = new Thread(r, "reference-extract-" + threadIds.incrementAndGet());
              t.setDaemon(true);
              return t;
            });
    try {
      List<Future<ExtractionResult>> futures = new ArrayList<>(units.size());
      for (StructuralUnit unit : units) {
        futures.add(pool.submit(() -> extract(unit, tree)));
      }
      List<ExtractionResult> parts = new ArrayList<>(units.size());
      for (Future<ExtractionResult> future : futures) {
        parts.add(future.get());
      }
      return ExtractionResult.merge(parts);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LexGraphException(LexGraphErrorCode.UNKNOWN, "Reference extraction interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) throw (RuntimeException) cause;
      throw new LexGraphException(LexGraphErrorCode.UNKNOWN, "Reference extraction failed", cause);
    } finally {
      pool.shutdownNow();
    }
  }

  /** References originating in one unit, ordered by position in its text. */
  public ExtractionResult extract(StructuralUnit unit, UnitTree tree) {
    String source = unit.getCitation();
    if (source == null || !unit.getStatus().isOperative() || unit.getText().isEmpty()) {
      return ExtractionResult.empty();
    }
    return extract(source, unit.getText(), tree.titleOf(unit), tree);
  }

  /**
   * References in {@code text} attributed to {@code sourceCitation}. Section numbers are qualified
   * with the title enclosing that citation, or with the document's first title when the citation
   * is not part of the tree.
   */
  public ExtractionResult extract(String sourceCitation, String text, UnitTree tree) {
    StructuralUnit title = tree.byCitation(sourceCitation).map(tree::titleOf).orElse(null);
    return extract(sourceCitation, text, title, tree);
  }

  private ExtractionResult extract(
      String sourceCitation, String text, StructuralUnit title, UnitTree tree) {
    String titleNumber = title == null ? tree.getDocumentTitle() : title.getDesignator();
    String prefix = title == null ? tree.getCitationPrefix() : title.getCitation();
    List<Candidate> accepted = acceptNonOverlapping(findCandidates(text));
    Map<String, StructuralUnit> index = tree.citationIndex();
    List<Reference> references = new ArrayList<>();
    List<ReferenceResolutionWarning> warnings = new ArrayList<>();

    for (Candidate candidate : accepted) {
      String phrase = text.substring(candidate.start, candidate.end);
      String qualifier = qualifierFor(text, candidate.end, titleNumber, prefix, tree);
      boolean external = qualifier == null;
      for (ReferencePattern.Target target : candidate.targets) {
        String targetCitation = (external ? prefix : qualifier) + " " + target.number();
        if (external) {
          warnings.add(
              new ReferenceResolutionWarning(
                  sourceCitation,
                  phrase,
                  targetCitation,
                  ReferenceResolutionWarning.Reason.EXTERNAL));
          continue;
        }
        if (!index.containsKey(targetCitation)) {
          warnings.add(
              new ReferenceResolutionWarning(
                  sourceCitation,
                  phrase,
                  targetCitation,
                  ReferenceResolutionWarning.Reason.UNRESOLVED));
          continue;
        }
        if (targetCitation.equals(sourceCitation)) {
          log.trace("Dropping self reference in {}", sourceCitation);
          continue;
        }
        references.add(
            new Reference(
                sourceCitation,
                targetCitation,
                candidate.pattern.getType(),
                context(text, candidate.start, candidate.end),
                target.position()));
      }
    }
    references.sort(Comparator.comparingInt(Reference::position));
    if (log.isDebugEnabled() && !references.isEmpty()) {
      log.debug("{}: {} references", sourceCitation, references.size());
    }
    return new ExtractionResult(references, warnings);
  }

  private List<Candidate> findCandidates(String text) {
    List<Candidate> candidates = new ArrayList<>();
    for (int priority = 0; priority < patterns.size(); priority++) {
      ReferencePattern pattern = patterns.get(priority);
      Matcher matcher = pattern.getPattern().matcher(text);
      while (matcher.find()) {
        candidates.add(
            new Candidate(
                pattern, priority, matcher.start(), matcher.end(), pattern.targets(matcher)));
      }
    }
    return candidates;
  }

  private static List<Candidate> acceptNonOverlapping(List<Candidate> candidates) {
    candidates.sort(
        Comparator.comparingInt((Candidate c) -> c.priority).thenComparingInt(c -> c.start));
    List<Candidate> accepted = new ArrayList<>();
    for (Candidate candidate : candidates) {
      boolean overlaps = false;
      for (Candidate kept : accepted) {
        if (candidate.start < kept.end && kept.start < candidate.end) {
          overlaps = true;
          break;
        }
      }
      if (!overlaps) accepted.add(candidate);
    }
    accepted.sort(Comparator.comparingInt(c -> c.start));
    return accepted;
  }

  /**
   * Citation prefix the numbers of one match are qualified with: the source title's own, or that of
   * another title of this document named by a trailing "of title X". {@code null} when the phrase
   * points to a title or Act outside the document.
   */
  private static String qualifierFor(
      String text, int matchEnd, String titleNumber, String prefix, UnitTree tree) {
    Matcher m = EXTERNAL_SUFFIX.matcher(text).region(matchEnd, text.length());
    if (!m.lookingAt()) return prefix;
    String named = m.group(1);
    if (named == null) return null;
    if (named.equalsIgnoreCase(titleNumber)) return prefix;
    for (StructuralUnit root : tree.roots()) {
      if (named.equalsIgnoreCase(root.getDesignator())) return root.getCitation();
    }
    return null;
  }

  /** The match padded evenly on both sides, never longer than the context window. */
  String context(String text, int start, int end) {
    int pad = Math.max(0, (contextWindow - (end - start)) / 2);
    int from = Math.max(0, start - pad);
    int to = Math.min(text.length(), end + pad);
    String window = text.substring(from, to).replaceAll("\\s+", " ").trim();
    return window.length() > contextWindow ? window.substring(0, contextWindow) : window;
  }

  private static final class Candidate {
    final ReferencePattern pattern;
    final int priority;
    final int start;
    final int end;
    final List<ReferencePattern.Target> targets;

    Candidate(
        ReferencePattern pattern,
        int priority,
        int start,
        int end,
        List<ReferencePattern.Target> targets) {
      this.pattern = pattern;
      this.priority = priority;
      this.start = start;
      this.end = end;
      this.targets = targets;
    }
  }
}
