package com.acme.corna.media;

import com.acme.corna.domain.repo.MediaRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AvatarSeederTest {
    @Mock
    MediaRepository mediaRepo;

    @Mock
    MediaService mediaService;

    @InjectMocks
    AvatarSeeder seeder;

    @TempDir
    Path seedDir;

    private void enable() throws Exception {
        Files.write(seedDir.resolve("cat.png"), new byte[]{1, 2, 3});
        Files.write(seedDir.resolve("dog.jpg"), new byte[]{4, 5});
        Files.writeString(seedDir.resolve("LICENSE.txt"), "cc0");
        ReflectionTestUtils.setField(seeder, "seedEnabled", true);
        ReflectionTestUtils.setField(seeder, "seedDir", seedDir.toString());
    }

    @Test
    void importsOnlyImagesIntoAvatarBucket() throws Exception {
        enable();
        when(mediaRepo.countByBucket("avatar")).thenReturn(0L);

        seeder.seedAvatars();

        verify(mediaService).save(any(), eq("cat.png"), eq(3L), eq(MediaBucket.AVATAR), isNull());
        verify(mediaService).save(any(), eq("dog.jpg"), eq(2L), eq(MediaBucket.AVATAR), isNull());
        verify(mediaService, never()).save(any(), eq("LICENSE.txt"), anyLong(), any(), any());
    }

    @Test
    void skipsWhenAvatarsAlreadyExist() throws Exception {
        enable();
        when(mediaRepo.countByBucket("avatar")).thenReturn(4L);

        seeder.seedAvatars();

        verifyNoInteractions(mediaService);
    }

    @Test
    void disabledByDefault() throws Exception {
        ReflectionTestUtils.setField(seeder, "seedDir", seedDir.toString());

        seeder.seedAvatars();

        verifyNoInteractions(mediaRepo, mediaService);
    }
}
