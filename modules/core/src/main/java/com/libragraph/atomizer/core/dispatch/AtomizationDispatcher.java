package com.libragraph.atomizer.core.dispatch;

import com.libragraph.atomizer.core.ingest.IngestionConfig;
import com.libragraph.atomizer.core.ingest.IngestionLimits;
import com.libragraph.atomizer.formats.api.AtomComposition;
import com.libragraph.atomizer.formats.api.AtomizationResult;
import com.libragraph.atomizer.formats.api.Atomizer;
import com.libragraph.atomizer.formats.api.CancellationToken;
import com.libragraph.atomizer.formats.api.ChildSource;
import com.libragraph.atomizer.formats.api.Position;
import com.libragraph.atomizer.formats.api.ResourceLimitExceededException;
import com.libragraph.atomizer.formats.api.SourceMetadata;
import com.libragraph.atomizer.formats.registry.AtomizerRegistry;
import com.libragraph.atomizer.util.ContentHash;
import com.libragraph.atomizer.util.buffer.BinaryData;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;

/**
 * Drives atomization of a source and, recursively, of every {@link ChildSource} it yields.
 *
 * <p>Work is kept on an explicit LIFO stack, so traversal is depth-first and a deep archive
 * never grows the call stack. Children are pushed in reverse and therefore visited in entry
 * order. A failing root propagates; a failing child is recorded as {@link NodeOutcome.Failed}
 * and its siblings continue. The edge {@code parent root -> child root} is added only once the
 * child has succeeded, so every edge refers to atoms present in the aggregate.
 *
 * <p>Each atomizer is handed what is left of {@code max-total-bytes} after the bytes already
 * visited and the bytes of materialized children still on the stack, so a container never
 * decompresses past the ceiling. Children it rejected for that reason fail as resource-limit nodes.
 *
 * <p>Child content buffers are owned by the dispatcher and closed after use; the root content
 * belongs to the caller.
 */
@ApplicationScoped
public class AtomizationDispatcher {

    private static final Logger log = Logger.getLogger(AtomizationDispatcher.class);

    private final AtomizerRegistry registry;
    private final IngestionLimits limits;

    @Inject
    public AtomizationDispatcher(AtomizerRegistry registry, IngestionConfig config) {
        this(registry, config.limits());
    }

    public AtomizationDispatcher(AtomizerRegistry registry, IngestionLimits limits) {
        this.registry = registry;
        this.limits = limits;
    }

    public IngestionLimits limits() {
        return limits;
    }

    private record Pending(BinaryData content, SourceMetadata source, ContentHash parentHash,
                           int entryIndex, Position position, int depth, String path,
                           ResourceLimitExceededException rejection) {
        boolean isRoot() {
            return parentHash == null;
        }
    }

    public DispatchResult dispatch(BinaryData content, SourceMetadata source, CancellationToken cancellation) {
        Deque<Pending> stack = new ArrayDeque<>();
        stack.push(new Pending(content, source, null, 0, null, 0, source.fileName(), null));
        List<NodeOutcome> nodes = new ArrayList<>();
        List<AtomComposition> links = new ArrayList<>();
        long totalBytes = 0;
        long pendingBytes = 0;

        try {
            while (!stack.isEmpty()) {
                cancellation.throwIfCancellationRequested();
                Pending node = stack.pop();
                try {
                    long size = node.content().size();
                    if (!node.isRoot()) {
                        pendingBytes -= size;
                    }
                    totalBytes += size;
                    long budget = Math.max(0, limits.maxTotalBytes() - totalBytes - pendingBytes);
                    Optional<NodeOutcome.Succeeded> done = visit(node, totalBytes, budget, cancellation, nodes);
                    if (done.isEmpty()) {
                        continue;
                    }
                    AtomizationResult result = done.get().result();
                    if (!node.isRoot()) {
                        links.add(new AtomComposition(node.parentHash(), result.rootHash(),
                                node.entryIndex(), node.position()));
                    }
                    List<ChildSource> children = result.childSources();
                    for (int i = children.size() - 1; i >= 0; i--) {
                        ChildSource child = children.get(i);
                        pendingBytes += child.content().size();
                        stack.push(new Pending(child.content(), child.source(), child.parentAtomHash(),
                                child.entryIndex(), child.position(), node.depth() + 1,
                                node.path() + "!/" + child.source().fileName(), child.rejection()));
                    }
                } finally {
                    if (!node.isRoot()) {
                        release(node);
                    }
                }
            }
        } catch (RuntimeException e) {
            stack.forEach(AtomizationDispatcher::release);
            throw e;
        }

        log.debugf("Dispatched %s: %d nodes, %d links", source.fileName(), nodes.size(), links.size());
        return new DispatchResult(nodes, links);
    }

    private Optional<NodeOutcome.Succeeded> visit(Pending node, long totalBytes, long budget,
                                                  CancellationToken cancellation, List<NodeOutcome> nodes) {
        try {
            if (node.rejection() != null) {
                throw node.rejection();
            }
            if (node.depth() > limits.maxDepth()) {
                throw new ResourceLimitExceededException("atomizer.ingest.max-depth", limits.maxDepth(), node.depth());
            }
            if (totalBytes > limits.maxTotalBytes()) {
                throw new ResourceLimitExceededException("atomizer.ingest.max-total-bytes",
                        limits.maxTotalBytes(), totalBytes);
            }
            SourceMetadata source = node.source();
            Optional<Atomizer> atomizer = registry.find(node.content(), source.contentType(), source.fileExtension());
            if (atomizer.isEmpty()) {
                if (node.isRoot()) {
                    throw new IllegalStateException("No atomizer registered for " + source.fileName());
                }
                nodes.add(new NodeOutcome.Failed(node.path(), node.depth(), source,
                        NodeFailure.unsupported("No atomizer for " + source.contentType())));
                return Optional.empty();
            }
            AtomizationResult result = atomizer.get().atomize(node.content(), source, cancellation, budget);
            NodeOutcome.Succeeded succeeded = new NodeOutcome.Succeeded(node.path(), node.depth(), source,
                    atomizer.get().name(), result);
            nodes.add(succeeded);
            return Optional.of(succeeded);
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            if (node.isRoot()) {
                throw e;
            }
            log.warnf("Child %s failed: %s", node.path(), e.getMessage());
            nodes.add(new NodeOutcome.Failed(node.path(), node.depth(), node.source(), NodeFailure.from(e)));
            return Optional.empty();
        }
    }

    private static void release(Pending node) {
        try {
            node.content().close();
        } catch (IOException e) {
            log.warnf(e, "Failed to release buffer of %s", node.path());
        }
    }
}
