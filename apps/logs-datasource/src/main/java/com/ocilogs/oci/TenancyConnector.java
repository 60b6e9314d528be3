package com.ocilogs.oci;

import com.ocilogs.model.CompartmentPage;
import com.ocilogs.model.LogSearch;
import com.ocilogs.model.SearchPage;
import java.util.List;

/**
 * Remote operations available for one tenancy. The target region is an explicit argument of
 * every call; a blank region means the tenancy's home region.
 */
public interface TenancyConnector extends AutoCloseable {
    String tenancyOcid();

    String defaultRegion();

    CompartmentPage listCompartments(String region, String compartmentId, String pageToken);

    String getTenancyName(String region, String tenancyOcid);

    List<String> listRegions(String region);

    List<String> listSubscribedRegions(String region, String tenancyOcid);

    SearchPage searchLogs(String region, LogSearch search);

    int listLogGroups(String region, String compartmentId, int limit);

    @Override
    void close();
}
