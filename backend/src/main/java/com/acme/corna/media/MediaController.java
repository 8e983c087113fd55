package com.acme.corna.media;

import com.acme.corna.security.SecurityUtils;
import jakarta.validation.Valid;
import org.springframework.core.io.Resource;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

@RestController
@RequestMapping("/api/v1/media")
public class MediaController {
    private final MediaService mediaService;
    private final AvatarService avatarService;
    private final ChunkUploadService chunkUploadService;

    public MediaController(MediaService mediaService, AvatarService avatarService, ChunkUploadService chunkUploadService) {
        this.mediaService = mediaService;
        this.avatarService = avatarService;
        this.chunkUploadService = chunkUploadService;
    }

    @PostMapping("/upload")
    @ResponseStatus(HttpStatus.CREATED)
    public MediaDtos.UploadResponse upload(@RequestParam("image") MultipartFile image, @RequestParam(value = "type", required = false) String type) {
        return mediaService.upload(image, MediaBucket.fromValue(type), SecurityUtils.principal().userId());
    }

    /**
     * Range requests are answered with 206 partial content by Spring's resource handling,
     * which lets browsers seek inside videos.
     */
    @GetMapping("/download/{urlExtension}")
    public ResponseEntity<Resource> download(@PathVariable String urlExtension) {
        MediaService.Download download = mediaService.download(urlExtension);
        return ResponseEntity.ok().contentType(download.mediaType()).body(download.resource());
    }

    @GetMapping("/avatar")
    public MediaDtos.AvatarResponse avatar() {
        return avatarService.randomAvatarLink();
    }

    @PostMapping("/chunk/upload")
    @ResponseStatus(HttpStatus.CREATED)
    public MediaDtos.ChunkResponse uploadChunk(
            @RequestParam("chunk") MultipartFile chunk,
            @RequestParam("chunkIndex") int chunkIndex,
            @RequestParam("totalChunks") int totalChunks,
            @RequestParam("uploadId") String uploadId
    ) {
        return chunkUploadService.store(chunk, chunkIndex, totalChunks, uploadId);
    }

    @GetMapping("/chunk/status/{uploadId}")
    public MediaDtos.ChunkStatus chunkStatus(@PathVariable String uploadId) {
        return chunkUploadService.status(uploadId);
    }

    @PostMapping("/chunk/merge")
    @ResponseStatus(HttpStatus.CREATED)
    public MediaDtos.UploadResponse merge(@RequestBody @Valid MediaDtos.MergeRequest request) {
        return chunkUploadService.merge(request, SecurityUtils.principal().userId());
    }
}
