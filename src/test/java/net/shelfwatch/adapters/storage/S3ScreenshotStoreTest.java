package net.shelfwatch.adapters.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;

@ExtendWith(MockitoExtension.class)
class S3ScreenshotStoreTest {

    @Mock
    private ObjectProvider<S3Client> s3ClientProvider;

    @Mock
    private S3Client s3Client;

    @Test
    void should_ReadKeyFromConfiguredBucket() {
        when(s3ClientProvider.getIfAvailable()).thenReturn(s3Client);
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenReturn(ResponseBytes.fromByteArray(GetObjectResponse.builder().build(), new byte[] {1, 2, 3}));

        assertThat(store("screenshots").load("/runs/abc.png")).hasValueSatisfying(bytes -> assertThat(bytes).hasSize(3));

        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObjectAsBytes(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo("screenshots");
        assertThat(captor.getValue().key()).isEqualTo("runs/abc.png");
    }

    @Test
    void should_UseBucketFromS3Uri_And_TreatMissingObjectAsAbsent() {
        when(s3ClientProvider.getIfAvailable()).thenReturn(s3Client);
        when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
            .thenThrow(NoSuchKeyException.builder().message("missing").build());

        assertThat(store("").load("s3://engine-shots/2026/03/run.png")).isEmpty();

        ArgumentCaptor<GetObjectRequest> captor = ArgumentCaptor.forClass(GetObjectRequest.class);
        verify(s3Client).getObjectAsBytes(captor.capture());
        assertThat(captor.getValue().bucket()).isEqualTo("engine-shots");
        assertThat(captor.getValue().key()).isEqualTo("2026/03/run.png");
    }

    @Test
    void should_ReturnEmpty_When_StorageUnconfigured() {
        assertThat(store("").load("runs/abc.png")).isEmpty();
        assertThat(store("").load(" ")).isEmpty();
        verifyNoInteractions(s3Client);
    }

    @Test
    void should_DownloadHttpReferences() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> Mono.just(
            ClientResponse.create(HttpStatus.OK).body("png-bytes").build()));
        S3ScreenshotStore store = new S3ScreenshotStore(s3ClientProvider, builder, "");

        assertThat(store.load("https://cdn.test/shot.png")).hasValueSatisfying(bytes -> assertThat(bytes).isNotEmpty());
        verifyNoInteractions(s3ClientProvider);
    }

    private S3ScreenshotStore store(String bucket) {
        return new S3ScreenshotStore(s3ClientProvider, WebClient.builder(), bucket);
    }
}
