package com.ambr.core.enrich;

import java.io.IOException;
import java.util.List;

/**
 * One remote call fetching attributes for a batch of SKUs.
 */
public interface EnrichmentTransport {

    /**
     * @param skus distinct SKUs of one batch
     * @return the service reply; {@code status == false} is treated like a transport failure
     * @throws MalformedEnrichmentResponseException when the reply cannot be interpreted
     * @throws IOException on transport failures and timeouts
     */
    EnrichmentResponse fetch(List<String> skus) throws IOException, InterruptedException;
}
