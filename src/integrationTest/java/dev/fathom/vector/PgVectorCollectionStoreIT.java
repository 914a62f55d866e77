package dev.fathom.vector;

import static org.assertj.core.api.Assertions.assertThat;

import dev.fathom.BaseIntegrationTest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class PgVectorCollectionStoreIT extends BaseIntegrationTest {

  @Autowired PgVectorCollectionStore collectionStore;

  @Autowired CollectionNames collectionNames;

  @Test
  void collectionLifecycle() {
    String collection = collectionNames.forProject("lifecycle");

    assertThat(collectionStore.find(collection)).isEmpty();

    collectionStore.getOrCreate(collection);
    assertThat(collectionStore.find(collection)).isPresent();

    assertThat(collectionStore.drop(collection)).isTrue();
    assertThat(collectionStore.find(collection)).isEmpty();
    assertThat(collectionStore.drop(collection)).isFalse();
  }

  @Test
  void collectionRecreatedAfterDropIsFoundAgain() {
    String collection = collectionNames.forProject("reopened");
    collectionStore.getOrCreate(collection);

    assertThat(collectionStore.drop(collection)).isTrue();
    collectionStore.getOrCreate(collection);

    assertThat(collectionStore.find(collection)).isPresent();
  }
}
