// file: storage/src/main/java/io/dectree/storage/FileIndexSnapshotter.java
package io.dectree.storage;

import io.dectree.core.Node;
import io.dectree.core.NodeIndex;
import io.dectree.core.Tags;
import io.dectree.core.Translation;
import io.dectree.core.VariantType;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;

/**
 * Binary snapshot of a {@link NodeIndex}, one file per snapshot.
 * <p>
 * Format (big-endian, {@link DataOutputStream}):
 *   int32 magic, int32 version
 *   int32 nodeCount
 *   repeated nodeCount times:
 *     - id, level, sortOrder:  int32
 *     - name, text:            string
 *     - hasParent:             boolean, then int32 parentId when true
 *   int32 translationCount
 *   repeated translationCount times:
 *     - nodeId, id:            int32
 *     - lang, text:            string
 *     - source, editor, tags:  nullable string (tags comma-joined)
 *     - variantType:           string ("translation" | "alternative")
 *     - createdAt, updatedAt:  int64 epoch seconds + int32 nanos
 * <p>
 * string = int32 len + UTF-8 bytes; nullable string uses len == -1 for null.
 * <p>
 * Atomicity: written to "index-NNNNNNNN.bin.tmp", then moved to
 * "index-NNNNNNNN.bin" with ATOMIC_MOVE. The highest number is the latest.
 */
public final class FileIndexSnapshotter implements IndexSnapshotter {
    private static final Logger log = Logger.getLogger(FileIndexSnapshotter.class.getName());

    private static final int MAGIC = 0xDEC7_1D58;
    private static final int VERSION = 1;
    private static final String PREFIX = "index-";
    private static final String SUFFIX = ".bin";

    private final Path dir;

    public FileIndexSnapshotter(Path dir) {
        this.dir = dir;
        try { Files.createDirectories(dir); } catch (IOException e) { throw new RuntimeException(e); }
    }

    @Override
    public synchronized String write(NodeIndex index) {
        List<Path> existing = snapshots();
        int seq = existing.isEmpty() ? 1 : sequenceOf(existing.get(existing.size() - 1)) + 1;
        String name = String.format(PREFIX + "%08d" + SUFFIX, seq);
        Path tmp = dir.resolve(name + ".tmp");
        Path dst = dir.resolve(name);

        int translations = 0;
        try (var out = new DataOutputStream(new BufferedOutputStream(Files.newOutputStream(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING)))) {
            out.writeInt(MAGIC);
            out.writeInt(VERSION);

            List<Node> nodes = index.nodes();
            // one copy per node: the header count and the records must agree
            // even while other sessions append alternatives
            List<List<Translation>> perNode = new ArrayList<>(nodes.size());
            out.writeInt(nodes.size());
            for (Node n : nodes) {
                out.writeInt(n.id());
                out.writeInt(n.level());
                out.writeInt(n.sortOrder());
                writeString(out, n.name());
                writeString(out, n.text());
                out.writeBoolean(n.parentId() != null);
                if (n.parentId() != null) out.writeInt(n.parentId());
                List<Translation> copy = List.copyOf(n.translations());
                perNode.add(copy);
                translations += copy.size();
            }

            out.writeInt(translations);
            for (int i = 0; i < nodes.size(); i++) {
                Node n = nodes.get(i);
                for (Translation t : perNode.get(i)) {
                    out.writeInt(n.id());
                    out.writeInt(t.id());
                    writeString(out, t.lang());
                    writeString(out, t.text());
                    writeNullable(out, t.source());
                    writeNullable(out, t.editor());
                    writeNullable(out, Tags.join(t.tags()));
                    writeString(out, t.variantType().wireName());
                    writeInstant(out, t.createdAt());
                    writeInstant(out, t.updatedAt());
                }
            }
        } catch (IOException ex) { throw new RuntimeException(ex); }

        try { Files.move(tmp, dst, ATOMIC_MOVE); }
        catch (IOException e) { throw new RuntimeException(e); }

        log.log(Level.INFO, "wrote index snapshot " + name + " (" + index.size() + " nodes, "
                + translations + " translations)");
        return name;
    }

    @Override
    public synchronized NodeIndex loadLatest() {
        List<Path> snaps = snapshots();
        if (snaps.isEmpty()) return null;
        Path snap = snaps.get(snaps.size() - 1);

        try (var in = new DataInputStream(new BufferedInputStream(Files.newInputStream(snap)))) {
            if (in.readInt() != MAGIC) throw new IllegalStateException("not an index snapshot: " + snap);
            int version = in.readInt();
            if (version != VERSION) throw new IllegalStateException("unsupported snapshot version " + version);

            int nodeCount = in.readInt();
            List<Node> nodes = new ArrayList<>(nodeCount);
            for (int i = 0; i < nodeCount; i++) {
                int id = in.readInt();
                int level = in.readInt();
                int sortOrder = in.readInt();
                String name = readString(in);
                String text = readString(in);
                Integer parentId = in.readBoolean() ? in.readInt() : null;
                nodes.add(new Node(id, name, text, level, sortOrder, parentId));
            }
            NodeIndex index = NodeIndex.restore(nodes);

            int translationCount = in.readInt();
            for (int i = 0; i < translationCount; i++) {
                int nodeId = in.readInt();
                int id = in.readInt();
                String lang = readString(in);
                String text = readString(in);
                String source = readNullable(in);
                String editor = readNullable(in);
                List<String> tags = Tags.normalize(readNullable(in));
                VariantType type = VariantType.fromWireName(readString(in));
                Instant created = readInstant(in);
                Instant updated = readInstant(in);
                Node owner = index.findById(nodeId)
                        .orElseThrow(() -> new IllegalStateException("translation " + id + " refers to missing node " + nodeId));
                index.restoreTranslation(owner, new Translation(id, lang, text, source, type, editor, tags, created, updated));
            }
            if (in.read() != -1) {
                throw new IllegalStateException("trailing bytes after " + translationCount + " translations in " + snap);
            }
            log.log(Level.INFO, "loaded index snapshot " + snap.getFileName() + " (" + index.size() + " nodes)");
            return index;
        } catch (IOException e) { throw new RuntimeException(e); }
    }

    private List<Path> snapshots() {
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .filter(p -> {
                        String f = p.getFileName().toString();
                        return f.startsWith(PREFIX) && f.endsWith(SUFFIX);
                    })
                    .sorted()
                    .toList();
        } catch (IOException e) { throw new RuntimeException(e); }
    }

    private static int sequenceOf(Path snapshot) {
        String f = snapshot.getFileName().toString();
        return Integer.parseInt(f.substring(PREFIX.length(), f.length() - SUFFIX.length()));
    }

    private static void writeString(DataOutputStream out, String s) throws IOException {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        out.writeInt(b.length);
        out.write(b);
    }

    private static String readString(DataInputStream in) throws IOException {
        String s = readNullable(in);
        if (s == null) throw new IllegalStateException("unexpected null string in snapshot");
        return s;
    }

    private static void writeNullable(DataOutputStream out, String s) throws IOException {
        if (s == null) {
            out.writeInt(-1);
            return;
        }
        writeString(out, s);
    }

    private static String readNullable(DataInputStream in) throws IOException {
        int len = in.readInt();
        if (len == -1) return null;
        return new String(in.readNBytes(len), StandardCharsets.UTF_8);
    }

    private static void writeInstant(DataOutputStream out, Instant t) throws IOException {
        out.writeLong(t.getEpochSecond());
        out.writeInt(t.getNano());
    }

    private static Instant readInstant(DataInputStream in) throws IOException {
        long seconds = in.readLong();
        int nanos = in.readInt();
        return Instant.ofEpochSecond(seconds, nanos);
    }
}
