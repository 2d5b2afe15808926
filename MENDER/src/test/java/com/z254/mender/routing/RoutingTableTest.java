package com.z254.mender.routing;

import com.z254.mender.config.MenderProperties;
import com.z254.mender.domain.model.ServiceMapping;
import com.z254.mender.observability.MenderStructuredLogger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.z254.mender.support.MenderTestFixture.mapping;
import static org.assertj.core.api.Assertions.assertThat;

class RoutingTableTest {

    private MenderProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MenderProperties();
        MenderProperties.Routing.Mapping checkout = mapping("checkout", "acme/shop");
        checkout.setBranch("develop");
        properties.getRouting().setServiceMappings(List.of(checkout, mapping("payments", "acme/payments")));
    }

    @Test
    void lookupIsDeterministic() {
        RoutingTable table = new RoutingTable(properties, new MenderStructuredLogger());

        assertThat(table.lookup("checkout")).contains(new ServiceMapping("checkout", "acme/shop", "develop"));
        assertThat(table.lookup("checkout")).isEqualTo(table.lookup("checkout"));
        assertThat(table.lookup("payments").map(ServiceMapping::branch)).contains("main");
        assertThat(table.lookup("inventory")).isEmpty();
        assertThat(table.lookup(null)).isEmpty();
    }

    @Test
    void branchForFallsBackToDefault() {
        properties.getRouting().setDefaultBranch("trunk");
        properties.getRouting().setServiceMappings(List.of(mapping("checkout", "acme/shop")));
        RoutingTable table = new RoutingTable(properties, new MenderStructuredLogger());

        assertThat(table.branchFor("acme/shop")).isEqualTo("trunk");
        assertThat(table.branchFor("acme/unknown")).isEqualTo("trunk");
    }

    @Test
    void branchForUsesFirstMappingOfRepository() {
        RoutingTable table = new RoutingTable(properties, new MenderStructuredLogger());
        table.replace(List.of(
                new ServiceMapping("checkout", "acme/shop", "develop"),
                new ServiceMapping("cart", "acme/shop", "release")));

        assertThat(table.branchFor("acme/shop")).isEqualTo("develop");
    }

    @Test
    void replaceSwapsSnapshotAndLaterDuplicateWins() {
        RoutingTable table = new RoutingTable(properties, new MenderStructuredLogger());

        table.replace(List.of(
                new ServiceMapping("inventory", "acme/old", null),
                new ServiceMapping("inventory", "acme/inventory", null)));

        assertThat(table.lookup("checkout")).isEmpty();
        assertThat(table.lookup("inventory").map(ServiceMapping::repository)).contains("acme/inventory");
        assertThat(table.size()).isEqualTo(1);
        assertThat(table.mappings()).hasSize(1);
    }
}
