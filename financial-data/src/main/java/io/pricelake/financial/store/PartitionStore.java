package io.pricelake.financial.store;

import io.pricelake.error.TransientIoException;
import io.pricelake.financial.frame.CsvFrameCodec;
import io.pricelake.financial.frame.Frame;
import io.pricelake.financial.model.Domain;
import io.pricelake.financial.model.EnrichedPartition;
import io.pricelake.financial.model.Partition;
import io.pricelake.financial.model.PartitionFrames;
import io.pricelake.financial.model.PartitionKey;
import io.pricelake.financial.model.Schemas;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Typed access to raw and enriched partitions in an {@link ObjectStore}. Store I/O failures surface as
 * {@link TransientIoException}; undecodable content surfaces as a data error.
 */
public class PartitionStore {
    private final ObjectStore objects;
    private final CsvFrameCodec codec;

    public PartitionStore(ObjectStore objects) {
        this(objects, new CsvFrameCodec());
    }

    public PartitionStore(ObjectStore objects, CsvFrameCodec codec) {
        this.objects = objects;
        this.codec = codec;
    }

    public List<PartitionKey> listKeys(Domain domain) {
        List<PartitionKey> keys = new ArrayList<>();
        for (String k : io(() -> objects.listKeys(PartitionKey.prefix(domain)))) {
            PartitionKey.parse(k).filter(pk -> pk.domain() == domain).ifPresent(keys::add);
        }
        keys.sort(null);
        return keys;
    }

    public List<PartitionKey> listKeys(Domain domain, String instrument) {
        return listKeys(domain).stream().filter(k -> k.instrument().equals(instrument)).toList();
    }

    public SortedSet<Integer> listYears(Domain domain, String instrument) {
        SortedSet<Integer> years = new TreeSet<>();
        for (PartitionKey k : listKeys(domain, instrument)) years.add(k.year());
        return years;
    }

    public boolean exists(PartitionKey key) {
        return io(() -> objects.exists(key.objectKey()));
    }

    /** The decoded file, typed per the key's domain schema; unchecked against it. */
    public Optional<Frame> readFrame(PartitionKey key) {
        return io(() -> objects.read(key.objectKey())).map(bytes -> codec.decode(bytes, Schemas.of(key.domain())));
    }

    public void writeFrame(PartitionKey key, Frame frame) {
        byte[] bytes = codec.encode(frame);
        io(() -> {
            objects.write(key.objectKey(), bytes);
            return null;
        });
    }

    public Optional<Partition> readRaw(PartitionKey key) {
        requireDomain(key, Domain.RAW);
        return readFrame(key).map(f -> PartitionFrames.toPartition(key, f));
    }

    public void writeRaw(Partition partition) {
        writeFrame(PartitionKey.raw(partition.year(), partition.instrument()), PartitionFrames.toFrame(partition));
    }

    public Optional<EnrichedPartition> readEnriched(PartitionKey key) {
        requireDomain(key, Domain.ENRICHED);
        return readFrame(key).map(f -> PartitionFrames.toEnriched(key, f));
    }

    public void writeEnriched(EnrichedPartition partition) {
        writeFrame(PartitionKey.enriched(partition.year(), partition.instrument()), PartitionFrames.toFrame(partition));
    }

    private static void requireDomain(PartitionKey key, Domain domain) {
        if (key.domain() != domain) throw new IllegalArgumentException("Expected a " + domain + " key, got " + key);
    }

    private static <T> T io(IoCall<T> call) {
        try {
            return call.run();
        } catch (IOException e) {
            throw new TransientIoException("Object store I/O failed: " + e.getMessage(), e);
        }
    }

    @FunctionalInterface
    private interface IoCall<T> {
        T run() throws IOException;
    }
}
