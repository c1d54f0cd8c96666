package floodgate.core.port.out;

import java.util.List;

import floodgate.core.model.policy.PolicyImportEntry;
import floodgate.core.model.policy.RateLimitPolicy;

/**
 * Port interface for serializing policy bundles.
 */
public interface PolicyCodec {

    /**
     * @return the format handled by this codec, e.g. {@code json}
     */
    String format();

    /**
     * Serialize policies into a bundle.
     *
     * @param policies the policies to export
     * @return the serialized bundle
     */
    String encode(List<RateLimitPolicy> policies);

    /**
     * Decode a bundle entry by entry.
     *
     * <p>Entries that cannot be decoded are returned as invalid entries rather
     * than failing the whole bundle.
     *
     * @param serialized the bundle
     * @return one entry per policy in the bundle
     * @throws floodgate.core.model.policy.InvalidImportDataException if the bundle itself is unreadable
     */
    List<PolicyImportEntry> decode(String serialized);
}
