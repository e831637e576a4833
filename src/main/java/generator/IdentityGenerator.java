package generator;

import config.ConfigurationException;
import config.IdentityMode;
import org.apache.commons.rng.UniformRandomProvider;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues entity identifiers and remembers every one issued during a run.
 * <ul>
 *   <li>HASHED: UUID made of the first 16 bytes of SHA-256(logical name), stable across runs</li>
 *   <li>SEEDED: version 4 shaped UUID drawn from the run's seeded generator</li>
 * </ul>
 */
public class IdentityGenerator {

    private final IdentityMode mode;
    private final UniformRandomProvider rng;
    private final Set<String> issued = ConcurrentHashMap.newKeySet();

    public IdentityGenerator(IdentityMode mode, UniformRandomProvider rng) {
        this.mode = mode;
        this.rng = rng;
    }

    public IdentityMode getMode() {
        return mode;
    }

    /**
     * @param logicalName stable name of the entity, e.g. {@code user_alice}; ignored in SEEDED mode
     * @throws ConfigurationException when two entities of a HASHED run share a logical name
     */
    public String idFor(String logicalName) {
        if (mode == IdentityMode.HASHED) {
            String id = hashedId(logicalName);
            if (!issued.add(id)) {
                throw new ConfigurationException("Duplicate logical name '" + logicalName + "' would reuse id " + id);
            }
            return id;
        }

        String id;
        do {
            id = seededId(rng);
        } while (!issued.add(id));
        return id;
    }

    public boolean isIssued(String id) {
        return issued.contains(id);
    }

    public int issuedCount() {
        return issued.size();
    }

    public Set<String> issuedIds() {
        return Collections.unmodifiableSet(issued);
    }

    public static String hashedId(String logicalName) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(logicalName.getBytes(StandardCharsets.UTF_8));
            ByteBuffer bytes = ByteBuffer.wrap(hash, 0, 16);
            return new UUID(bytes.getLong(), bytes.getLong()).toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static String seededId(UniformRandomProvider rng) {
        long msb = (rng.nextLong() & ~0xF000L) | 0x4000L;
        long lsb = (rng.nextLong() & 0x3FFFFFFFFFFFFFFFL) | 0x8000000000000000L;
        return new UUID(msb, lsb).toString();
    }
}
