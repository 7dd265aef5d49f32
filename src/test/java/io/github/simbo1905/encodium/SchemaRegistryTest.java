// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//
package io.github.simbo1905.encodium;

import io.github.simbo1905.LoggingControl;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class SchemaRegistryTest {

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void builderKeepsDeclarationOrder() {
    final var registry = new SchemaRegistry();
    final var schema = registry.schema("Ordered")
        .field("zulu", FieldType.bool())
        .field("alpha", FieldType.integer())
        .field("mike", FieldType.string())
        .register();
    assertThat(schema.fieldNames()).containsExactly("zulu", "alpha", "mike");
    assertThat(schema.fields()).extracting(FieldSpec::sequence).containsExactly(0, 1, 2);
    assertThat(schema.indexOf("mike")).isEqualTo(2);
    assertThat(schema.indexOf("missing")).isEqualTo(-1);
  }

  @Test
  void lowLevelRegistrationOrdersBySequenceNotListOrder() {
    final var registry = new SchemaRegistry();
    final var schema = registry.register("BySequence", List.of(
        new FieldSpec("second", FieldType.string(), false, Optional.empty(), List.of(), 20),
        new FieldSpec("first", FieldType.bool(), false, Optional.empty(), List.of(), 10)));
    assertThat(schema.fieldNames()).containsExactly("first", "second");
  }

  @Test
  void duplicateFieldNamesAndSequencesAreRejected() {
    final var registry = new SchemaRegistry();
    assertThatThrownBy(() -> registry.schema("Dup")
        .field("a", FieldType.bool())
        .field("a", FieldType.bool())
        .register())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("more than once");
    assertThatThrownBy(() -> registry.register("SameSequence", List.of(
        new FieldSpec("a", FieldType.bool(), false, Optional.empty(), List.of(), 1),
        new FieldSpec("b", FieldType.bool(), false, Optional.empty(), List.of(), 1))))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("share sequence");
  }

  @Test
  void duplicateSchemaNameIsRejected() {
    final var registry = new SchemaRegistry();
    registry.schema("Person").field("name", FieldType.string()).register();
    assertThatThrownBy(() -> registry.schema("Person").field("age", FieldType.integer()).register())
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("already registered");
  }

  @Test
  void resolveUnknownSchemaFails() {
    final var registry = new SchemaRegistry();
    assertThatThrownBy(() -> registry.resolve("Nope"))
        .isInstanceOf(ValidationException.UnknownSchema.class)
        .hasMessage("no schema named Nope is registered");
  }

  @Test
  void freezeEndsRegistration() {
    final var registry = new SchemaRegistry();
    final var person = registry.schema("Person").field("name", FieldType.string()).register();
    assertThat(registry.isFrozen()).isFalse();
    registry.freeze();
    registry.freeze();
    assertThat(registry.isFrozen()).isTrue();
    assertThat(registry.resolve("Person")).isSameAs(person);
    assertThat(registry.names()).containsExactly("Person");
    assertThatThrownBy(() -> registry.schema("Late").field("x", FieldType.bool()).register())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void referenceResolvesLazilyOnFirstUse() {
    final var registry = new SchemaRegistry();
    final var addressRef = registry.reference("Address");
    final var person = registry.schema("Person")
        .field("name", FieldType.string())
        .field("home", addressRef, FieldOption.optional())
        .register();
    assertThat(addressRef.reference().isResolved()).isFalse();

    // a person without an address does not need the referenced schema
    final var nomad = person.construct(Map.of("name", "Nomad"));
    assertThat(nomad.get("home")).isNull();

    assertThatThrownBy(() -> person.construct(Map.of("name", "Ann", "home", nomad)))
        .isInstanceOf(ValidationException.UnknownSchema.class)
        .hasMessage("home no schema named Address is registered");

    final var address = registry.schema("Address").field("street", FieldType.string()).register();
    final var home = address.construct(Map.of("street", "1 Main St"));
    final var ann = person.construct(Map.of("name", "Ann", "home", home));
    assertThat(addressRef.reference().isResolved()).isTrue();
    assertThat(ann.getRecord("home")).isEqualTo(home);
  }

  @Test
  void recordFieldRejectsOtherSchemas() {
    final var registry = new SchemaRegistry();
    final var cat = registry.schema("Cat").field("name", FieldType.string()).register();
    final var dog = registry.schema("Dog").field("name", FieldType.string()).register();
    final var owner = registry.schema("Owner").field("pet", FieldType.record(cat)).register();
    final var rex = dog.construct(Map.of("name", "Rex"));
    assertThatThrownBy(() -> owner.construct(Map.of("pet", rex)))
        .isInstanceOf(ValidationException.TypeMismatch.class)
        .hasMessage("pet is of type Dog, expected Cat");
  }

  @Test
  void globalRegistryIsShared() {
    assertThat(SchemaRegistry.global()).isSameAs(SchemaRegistry.global());
  }

  @Test
  void schemaDescribesItself() {
    final var registry = new SchemaRegistry();
    final var schema = registry.schema("Tree")
        .field("children", FieldType.list(registry.reference("Tree")))
        .field("label", FieldType.string(), FieldOption.optional())
        .register();
    assertThat(schema).hasToString("Schema{name=Tree, fields=[children:List<Tree>, label:String?]}");
  }
}
