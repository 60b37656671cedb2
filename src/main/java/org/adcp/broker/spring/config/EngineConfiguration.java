package org.adcp.broker.spring.config;

import org.adcp.broker.adserver.AdServerClient;
import org.adcp.broker.adserver.DryRunAdServerClient;
import org.adcp.broker.campaign.BrokerErrorFactory;
import org.adcp.broker.campaign.CreativeSyncService;
import org.adcp.broker.campaign.MediaBuyService;
import org.adcp.broker.creative.CreativeDimensionsResolver;
import org.adcp.broker.creative.PlaceholderSlotFactory;
import org.adcp.broker.creative.PlaceholderValidator;
import org.adcp.broker.format.FileFormatStorage;
import org.adcp.broker.format.FormatCatalog;
import org.adcp.broker.format.FormatResolver;
import org.adcp.broker.format.FormatStorage;
import org.adcp.broker.json.JacksonMapper;
import org.adcp.broker.json.ObjectMapperProvider;
import org.adcp.broker.protocol.EnvelopeWriter;
import org.adcp.broker.protocol.ProtocolEnvelopeMapper;
import org.adcp.broker.protocol.TaskArtifactEnvelopeWriter;
import org.adcp.broker.protocol.ToolCallEnvelopeWriter;
import org.adcp.broker.targeting.TargetingAccessController;
import org.adcp.broker.targeting.TargetingClassification;
import org.adcp.broker.targeting.TargetingClassificationLoader;
import org.adcp.broker.util.JsonMergeUtil;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

import java.time.Clock;
import java.util.List;

@Configuration
public class EngineConfiguration {

    @Bean
    static PropertySourcesPlaceholderConfigurer propertySourcesPlaceholderConfigurer() {
        return new PropertySourcesPlaceholderConfigurer();
    }

    @Bean
    JacksonMapper jacksonMapper() {
        return new JacksonMapper(ObjectMapperProvider.mapper());
    }

    @Bean
    JsonMergeUtil jsonMergeUtil(JacksonMapper mapper) {
        return new JsonMergeUtil(mapper);
    }

    @Bean
    FormatStorage formatStorage(
            @Value("${broker.formats.settings-file:classpath:formats.yaml}") String settingsFile) {

        return FileFormatStorage.fromLocation(settingsFile);
    }

    @Bean
    FormatResolver formatResolver(FormatStorage formatStorage, JsonMergeUtil jsonMergeUtil) {
        return new FormatResolver(formatStorage, jsonMergeUtil);
    }

    @Bean
    FormatCatalog formatCatalog(FormatStorage formatStorage, JsonMergeUtil jsonMergeUtil) {
        return new FormatCatalog(formatStorage, jsonMergeUtil);
    }

    @Bean
    TargetingClassification targetingClassification(
            @Value("${broker.targeting.classification-file:classpath:targeting-classification.yaml}")
            String classificationFile) {

        return TargetingClassificationLoader.load(classificationFile);
    }

    @Bean
    TargetingAccessController targetingAccessController(TargetingClassification targetingClassification) {
        return new TargetingAccessController(targetingClassification);
    }

    @Bean
    CreativeDimensionsResolver creativeDimensionsResolver() {
        return new CreativeDimensionsResolver();
    }

    @Bean
    PlaceholderSlotFactory placeholderSlotFactory(@Value("${broker.creative.ad-server:gam}") String adServer) {
        return new PlaceholderSlotFactory(adServer);
    }

    @Bean
    PlaceholderValidator placeholderValidator(CreativeDimensionsResolver creativeDimensionsResolver) {
        return new PlaceholderValidator(creativeDimensionsResolver);
    }

    @Bean
    BrokerErrorFactory brokerErrorFactory(JacksonMapper mapper) {
        return new BrokerErrorFactory(mapper);
    }

    @Bean
    ToolCallEnvelopeWriter toolCallEnvelopeWriter(JacksonMapper mapper) {
        return new ToolCallEnvelopeWriter(mapper);
    }

    @Bean
    TaskArtifactEnvelopeWriter taskArtifactEnvelopeWriter(JacksonMapper mapper) {
        return new TaskArtifactEnvelopeWriter(mapper);
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ProtocolEnvelopeMapper protocolEnvelopeMapper(List<EnvelopeWriter> envelopeWriters, Clock clock) {
        return new ProtocolEnvelopeMapper(envelopeWriters, clock);
    }

    @Bean
    MediaBuyService mediaBuyService(TargetingAccessController targetingAccessController,
                                    FormatResolver formatResolver,
                                    PlaceholderSlotFactory placeholderSlotFactory,
                                    ObjectProvider<AdServerClient> adServerClient,
                                    BrokerErrorFactory brokerErrorFactory) {

        return new MediaBuyService(
                targetingAccessController,
                formatResolver,
                placeholderSlotFactory,
                adServerClient.getIfAvailable(DryRunAdServerClient::new),
                brokerErrorFactory);
    }

    @Bean
    CreativeSyncService creativeSyncService(PlaceholderValidator placeholderValidator,
                                            ObjectProvider<AdServerClient> adServerClient,
                                            BrokerErrorFactory brokerErrorFactory) {

        return new CreativeSyncService(
                placeholderValidator,
                adServerClient.getIfAvailable(DryRunAdServerClient::new),
                brokerErrorFactory);
    }
}
