package io.pricelake.financial.model;

import java.util.Comparator;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies one partition: {@code <domain>/<year>/<instrument>_metrics.csv} in the object store.
 */
public record PartitionKey(Domain domain, int year, String instrument) implements Comparable<PartitionKey> {
    public static final String SUFFIX = "_metrics.csv";
    private static final Pattern KEY = Pattern.compile("^(raw|enriched)/(\\d{4})/(.+)" + Pattern.quote(SUFFIX) + "$");
    private static final Comparator<PartitionKey> ORDER = Comparator.comparing(PartitionKey::domain)
            .thenComparingInt(PartitionKey::year)
            .thenComparing(PartitionKey::instrument);

    public PartitionKey {
        Objects.requireNonNull(domain, "domain");
        Objects.requireNonNull(instrument, "instrument");
        if (instrument.isBlank() || instrument.contains("/")) {
            throw new IllegalArgumentException("Invalid instrument id: '" + instrument + "'");
        }
    }

    public static PartitionKey raw(int year, String instrument) { return new PartitionKey(Domain.RAW, year, instrument); }
    public static PartitionKey enriched(int year, String instrument) { return new PartitionKey(Domain.ENRICHED, year, instrument); }

    public static Optional<PartitionKey> parse(String objectKey) {
        Matcher m = KEY.matcher(objectKey);
        if (!m.matches()) return Optional.empty();
        Domain domain = m.group(1).equals("raw") ? Domain.RAW : Domain.ENRICHED;
        return Optional.of(new PartitionKey(domain, Integer.parseInt(m.group(2)), m.group(3)));
    }

    public static String prefix(Domain domain) { return domain.prefix() + "/"; }

    public String objectKey() {
        return domain.prefix() + "/" + year + "/" + instrument + SUFFIX;
    }

    public PartitionKey in(Domain other) { return new PartitionKey(other, year, instrument); }

    public PartitionKey previousYear() { return new PartitionKey(domain, year - 1, instrument); }

    @Override
    public int compareTo(PartitionKey o) { return ORDER.compare(this, o); }

    @Override
    public String toString() { return objectKey(); }
}
