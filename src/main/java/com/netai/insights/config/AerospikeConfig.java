package com.netai.insights.config;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.policy.ClientPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Aerospike client for the bundle store. Only created when {@code netai.model-store.type=aerospike}.
 */
@Configuration
@ConditionalOnProperty(name = "netai.model-store.type", havingValue = "aerospike")
public class AerospikeConfig {

    private final ModelStoreConfig storeConfig;

    public AerospikeConfig(ModelStoreConfig storeConfig) {
        this.storeConfig = storeConfig;
    }

    @Bean(destroyMethod = "close")
    public AerospikeClient aerospikeClient() {
        ClientPolicy clientPolicy = new ClientPolicy();
        clientPolicy.timeout = 5000;

        clientPolicy.readPolicyDefault.totalTimeout = 3000;
        clientPolicy.readPolicyDefault.socketTimeout = 1000;

        // bundles can be large, give writes more room than reads
        clientPolicy.writePolicyDefault.totalTimeout = 5000;
        clientPolicy.writePolicyDefault.socketTimeout = 2000;

        ModelStoreConfig.Aerospike aerospike = storeConfig.getAerospike();
        return new AerospikeClient(clientPolicy, aerospike.getHost(), aerospike.getPort());
    }

    @Bean
    public WritePolicy bundleWritePolicy() {
        WritePolicy policy = new WritePolicy();
        policy.totalTimeout = 5000;
        policy.socketTimeout = 2000;
        return policy;
    }

    @Bean
    public Policy bundleReadPolicy() {
        Policy policy = new Policy();
        policy.totalTimeout = 3000;
        policy.socketTimeout = 1000;
        return policy;
    }
}
