// file: storage/src/main/java/io/tilelite/storage/catalog/FileAttributeStore.java
package io.tilelite.storage.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.tilelite.core.layer.AttributeCorruptException;
import io.tilelite.core.layer.LayerId;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardOpenOption.*;

/**
 * Attribute store keeping one JSON document per layer.
 * <p>
 * Layout:
 *   root/&lt;layer name, URL-encoded, dots escaped&gt;/&lt;zoom&gt;.json = { "header": {...}, "keyBounds": {...}, ... }
 * <p>
 * Atomicity:
 *   - the whole document is written to "&lt;zoom&gt;.json.tmp" and fsynced,
 *   - then moved over "&lt;zoom&gt;.json" using ATOMIC_MOVE.
 * A reader therefore sees either the previous or the next document, never a mix.
 */
public final class FileAttributeStore implements AttributeStore {
    private static final String SUFFIX = ".json";

    private final Path root;
    private final ObjectMapper mapper = new ObjectMapper();
    private final Object writeLock = new Object();

    public FileAttributeStore(Path root) {
        this.root = root;
        try { Files.createDirectories(root); } catch (IOException e) { throw new RuntimeException(e); }
    }

    @Override
    public JsonNode read(LayerId id, String attribute) {
        ObjectNode doc = readDocument(id, attribute);
        return doc == null ? null : doc.get(attribute);
    }

    @Override
    public void write(LayerId id, String attribute, JsonNode value) {
        synchronized (writeLock) {
            ObjectNode doc = readDocument(id, attribute);
            if (doc == null) doc = mapper.createObjectNode();
            doc.set(attribute, value.deepCopy());
            store(id, doc);
        }
    }

    @Override
    public void writeAll(LayerId id, Map<String, JsonNode> attributes) {
        ObjectNode doc = mapper.createObjectNode();
        attributes.forEach((name, value) -> doc.set(name, value.deepCopy()));
        synchronized (writeLock) {
            store(id, doc);
        }
    }

    @Override
    public boolean layerExists(LayerId id) {
        return Files.exists(file(id));
    }

    @Override
    public List<LayerId> layerIds() {
        List<LayerId> ids = new ArrayList<>();
        try (Stream<Path> dirs = Files.list(root)) {
            for (Path dir : dirs.filter(Files::isDirectory).toList()) {
                String name = URLDecoder.decode(dir.getFileName().toString(), StandardCharsets.UTF_8);
                try (Stream<Path> files = Files.list(dir)) {
                    for (Path f : files.toList()) {
                        String fn = f.getFileName().toString();
                        if (!fn.matches("\\d+\\.json")) continue;
                        ids.add(new LayerId(name, Integer.parseInt(fn.substring(0, fn.length() - SUFFIX.length()))));
                    }
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("cannot list layers under " + root, e);
        }
        ids.sort(Comparator.comparing(LayerId::name).thenComparingInt(LayerId::zoom));
        return ids;
    }

    private Path file(LayerId id) {
        return root.resolve(encodeName(id.name())).resolve(id.zoom() + SUFFIX);
    }

    /** URL encoding with '.' escaped too, so no name maps to a "." or ".." directory. */
    static String encodeName(String name) {
        return URLEncoder.encode(name, StandardCharsets.UTF_8).replace(".", "%2E");
    }

    private ObjectNode readDocument(LayerId id, String attribute) {
        Path f = file(id);
        if (!Files.exists(f)) return null;
        JsonNode doc;
        try {
            doc = mapper.readTree(Files.readAllBytes(f));
        } catch (JsonProcessingException e) {
            throw new AttributeCorruptException(id, attribute, e);
        } catch (IOException e) {
            throw new RuntimeException("cannot read attributes of " + id, e);
        }
        if (doc == null || !doc.isObject()) {
            throw new AttributeCorruptException(id, attribute, "attribute document is not a JSON object");
        }
        return (ObjectNode) doc;
    }

    private void store(LayerId id, ObjectNode doc) {
        Path dst = file(id);
        Path tmp = dst.resolveSibling(dst.getFileName() + ".tmp");
        try {
            Files.createDirectories(dst.getParent());
            byte[] bytes = mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(doc);
            try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(bytes);
                while (buf.hasRemaining()) ch.write(buf);
                ch.force(true);
            }
            Files.move(tmp, dst, ATOMIC_MOVE);
        } catch (IOException e) {
            throw new RuntimeException("cannot write attributes of " + id, e);
        }
    }
}
