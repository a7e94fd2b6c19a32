package spotlane.cloud.catalog;

/**
 * One GPU offering from one provider.
 *
 * @param providerGpuId    the provider's own identifier for the GPU
 * @param pricePerGpuHour  USD; 0 when not listed
 */
public record ProviderGpu(String gpu, String provider, String providerGpuId, double pricePerGpuHour) {

    public boolean isPriced() {
        return pricePerGpuHour > 0;
    }
}
