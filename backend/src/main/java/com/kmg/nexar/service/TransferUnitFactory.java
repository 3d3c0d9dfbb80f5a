package com.kmg.nexar.service;

import com.kmg.nexar.config.DownloadProperties;
import com.kmg.nexar.model.DownloadJob;
import org.springframework.stereotype.Component;

@Component
public class TransferUnitFactory {
    private final SourceResolver sourceResolver;
    private final BandwidthAllocator bandwidthAllocator;
    private final PartialFileVerifier verifier;
    private final DiskSpaceGuard diskSpaceGuard;
    private final RetryPolicy retryPolicy;
    private final DownloadProperties properties;

    public TransferUnitFactory(
            SourceResolver sourceResolver,
            BandwidthAllocator bandwidthAllocator,
            PartialFileVerifier verifier,
            DiskSpaceGuard diskSpaceGuard,
            RetryPolicy retryPolicy,
            DownloadProperties properties
    ) {
        this.sourceResolver = sourceResolver;
        this.bandwidthAllocator = bandwidthAllocator;
        this.verifier = verifier;
        this.diskSpaceGuard = diskSpaceGuard;
        this.retryPolicy = retryPolicy;
        this.properties = properties;
    }

    public TransferUnit create(DownloadJob job, TransferControl control, TransferListener listener) {
        return new TransferUnit(
                job,
                control,
                listener,
                sourceResolver,
                bandwidthAllocator,
                verifier,
                diskSpaceGuard,
                retryPolicy,
                properties.getChunkSize(),
                properties.downloadDirPath(),
                properties.getBandwidth().getPollInterval()
        );
    }
}
