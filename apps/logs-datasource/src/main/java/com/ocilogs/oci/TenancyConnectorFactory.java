package com.ocilogs.oci;

import com.ocilogs.settings.DatasourceSettings;
import com.ocilogs.settings.TenancyProfile;

public interface TenancyConnectorFactory {
    TenancyConnector forProfile(TenancyProfile profile);

    TenancyConnector forInstancePrincipal(DatasourceSettings settings);
}
