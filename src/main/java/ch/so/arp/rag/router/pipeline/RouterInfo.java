package ch.so.arp.rag.router.pipeline;

import java.util.List;

/**
 * Describes the services and capabilities of the running router.
 */
public record RouterInfo(List<String> services, List<String> capabilities, String model) {

    public RouterInfo {
        services = List.copyOf(services);
        capabilities = List.copyOf(capabilities);
    }
}
