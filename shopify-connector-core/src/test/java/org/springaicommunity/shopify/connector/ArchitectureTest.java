package org.springaicommunity.shopify.connector;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

/**
 * Architecture tests using ArchUnit to enforce dependency rules and layering.
 *
 * <h3>Interfaces (Contracts)</h3>
 * <ul>
 * <li>{@link ShopifyClient} - HTTP transport bound to one shop</li>
 * <li>{@link ResourceType} - Paginated collection capabilities</li>
 * <li>{@link ResourceService} - Typed resource accessors</li>
 * </ul>
 *
 * <h3>Dependency Rules</h3> <pre>
 *   Services, executor, paginator → ShopifyClient (NOT ShopifyHttpClient)
 *   Only ShopifyConnectorBuilder → ShopifyHttpClient
 *   Models → nothing above them
 * </pre>
 */
@AnalyzeClasses(packages = "org.springaicommunity.shopify.connector",
		importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

	// ========== Interface Dependency Rules ==========

	@ArchTest
	static final ArchRule services_should_depend_on_client_interface = noClasses().that()
		.haveSimpleNameEndingWith("Service")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("ShopifyHttpClient")
		.because("Services should depend on the ShopifyClient interface, not the concrete ShopifyHttpClient");

	@ArchTest
	static final ArchRule request_pipeline_should_depend_on_client_interface = noClasses().that()
		.haveSimpleName("RequestExecutor")
		.or()
		.haveSimpleName("Paginator")
		.or()
		.haveSimpleName("ShopifyApi")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("ShopifyHttpClient")
		.because("The request pipeline receives its client through ShopifyClient");

	@ArchTest
	static final ArchRule only_builder_should_instantiate_http_client = noClasses().that()
		.doNotHaveSimpleName("ShopifyConnectorBuilder")
		.and()
		.doNotHaveSimpleName("ShopifyHttpClient")
		.should()
		.dependOnClassesThat()
		.haveSimpleName("ShopifyHttpClient")
		.because("Only ShopifyConnectorBuilder should create the default HTTP client");

	// ========== Implementation Rules ==========

	@ArchTest
	static final ArchRule clients_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("Client")
		.and()
		.doNotHaveSimpleName("ShopifyClient")
		.should()
		.implement(ShopifyClient.class)
		.because("All *Client classes should implement the ShopifyClient interface");

	@ArchTest
	static final ArchRule resource_services_should_implement_interface = classes().that()
		.haveSimpleNameEndingWith("ResourceService")
		.and()
		.doNotHaveSimpleName("ResourceService")
		.should()
		.implement(ResourceService.class)
		.because("All *ResourceService classes should implement the ResourceService interface");

	// ========== Model Independence ==========

	@ArchTest
	static final ArchRule models_should_not_depend_on_services = noClasses().that()
		.haveSimpleName("Product")
		.or()
		.haveSimpleName("Variant")
		.or()
		.haveSimpleName("ProductOption")
		.or()
		.haveSimpleName("ProductImage")
		.or()
		.haveSimpleName("Metafield")
		.or()
		.haveSimpleName("ShopifySession")
		.or()
		.haveSimpleNameEndingWith("Response")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.orShould()
		.dependOnClassesThat()
		.haveSimpleName("ShopifyApi")
		.because("Model classes should be pure data without service dependencies");

	// ========== Support Classes ==========

	@ArchTest
	static final ArchRule support_classes_should_not_depend_on_services = noClasses().that()
		.haveSimpleNameEndingWith("Utils")
		.or()
		.haveSimpleNameEndingWith("Parser")
		.or()
		.haveSimpleNameEndingWith("Encoder")
		.should()
		.dependOnClassesThat()
		.haveSimpleNameEndingWith("Service")
		.because("Support/utility classes should not depend on higher-level services");

	@ArchTest
	static final ArchRule no_spring_dependencies = noClasses().should()
		.dependOnClassesThat()
		.resideInAPackage("org.springframework..")
		.because("The connector is framework-free and wired by ShopifyConnectorBuilder");

}
