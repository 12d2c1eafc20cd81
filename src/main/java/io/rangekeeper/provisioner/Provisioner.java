package io.rangekeeper.provisioner;

import io.rangekeeper.error.ProvisionerException;

public interface Provisioner {
    WorkloadHandle start(WorkloadSpec spec) throws ProvisionerException;

    void stop(WorkloadHandle handle) throws ProvisionerException;
}
