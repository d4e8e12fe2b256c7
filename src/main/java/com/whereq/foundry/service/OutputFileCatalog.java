package com.whereq.foundry.service;

import com.whereq.foundry.cache.JobCache;
import com.whereq.foundry.config.FoundryProperties;
import com.whereq.foundry.exception.JobNotFoundException;
import com.whereq.foundry.exception.OutputNotFoundException;
import com.whereq.foundry.model.JobMetadata;
import com.whereq.foundry.model.OutputFile;
import com.whereq.foundry.store.JobRecordStore;
import com.whereq.foundry.store.JobSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Lists the files a worker left in its output directory.
 *
 * <p>The output directory comes from the job's metadata, in memory first and then in
 * the cache. Directory reads run on the bounded elastic scheduler. A non-empty listing
 * is mirrored to the cache so it can still be served once the directory is gone.
 *
 * @author WhereQ Inc.
 */
@Slf4j
@Service
public class OutputFileCatalog {

    static final String BEATMAP_EXTENSION = ".osz";

    private final JobRecordStore store;
    private final JobCache jobCache;
    private final String downloadBasePath;

    @Autowired
    public OutputFileCatalog(JobRecordStore store, JobCache jobCache, FoundryProperties properties) {
        this.store = store;
        this.jobCache = jobCache;
        this.downloadBasePath = properties.getDownload().getBasePath();
    }

    /**
     * Files of a job's output directory, sorted by name.
     *
     * @param jobId job identifier
     * @return the current listing, else the cached one, else an empty list
     */
    public Mono<List<OutputFile>> list(String jobId) {
        return outputDirectory(jobId)
            .flatMap(directory -> scan(jobId, directory))
            .filter(files -> !files.isEmpty())
            .doOnNext(files -> jobCache.mirrorOutputFiles(jobId, files).subscribe())
            .switchIfEmpty(Mono.defer(() -> jobCache.findOutputFiles(jobId)))
            .defaultIfEmpty(List.of());
    }

    /**
     * Locate a file for download.
     *
     * @param jobId job identifier
     * @param filename wanted file name; when null or blank the first {@code .osz} file,
     *                 else the first file, is chosen
     * @return absolute path of the file
     */
    public Mono<Path> resolveDownload(String jobId, String filename) {
        return outputDirectory(jobId)
            .switchIfEmpty(Mono.error(() -> new JobNotFoundException(jobId)))
            .flatMap(directory -> scan(jobId, directory)
                .flatMap(files -> pick(files, filename)
                    .map(file -> Mono.just(directory.resolve(file.getName())))
                    .orElseGet(() -> Mono.error(new OutputNotFoundException(describeMissing(jobId, filename))))));
    }

    static Optional<OutputFile> pick(List<OutputFile> files, String filename) {
        if (filename != null && !filename.isBlank()) {
            return files.stream().filter(file -> file.getName().equals(filename)).findFirst();
        }
        return files.stream()
            .filter(file -> BEATMAP_EXTENSION.equalsIgnoreCase(file.getType()))
            .findFirst()
            .or(() -> files.stream().findFirst());
    }

    private Mono<Path> outputDirectory(String jobId) {
        return Mono.justOrEmpty(store.find(jobId).map(JobSnapshot::getMetadata))
            .switchIfEmpty(Mono.defer(() -> jobCache.findMetadata(jobId)))
            .mapNotNull(JobMetadata::getOutputDirectory)
            .map(Path::of);
    }

    private Mono<List<OutputFile>> scan(String jobId, Path directory) {
        return Mono.fromCallable(() -> listDirectory(jobId, directory))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private List<OutputFile> listDirectory(String jobId, Path directory) {
        if (!Files.isDirectory(directory)) {
            log.debug("Output directory {} of job {} does not exist", directory, jobId);
            return List.of();
        }

        List<OutputFile> files = new ArrayList<>();
        try (Stream<Path> entries = Files.list(directory)) {
            for (Path path : entries.filter(Files::isRegularFile).sorted(Comparator.comparing(Path::getFileName)).toList()) {
                String name = path.getFileName().toString();
                files.add(OutputFile.builder()
                    .name(name)
                    .size(Files.size(path))
                    .type(extension(name))
                    .downloadUrl(downloadUrl(jobId, name))
                    .build());
            }
        } catch (IOException e) {
            log.warn("Failed to list output directory {} of job {}: {}", directory, jobId, e.getMessage());
            return List.of();
        }
        return files;
    }

    private String downloadUrl(String jobId, String name) {
        return downloadBasePath + "/" + jobId + "/download?filename=" + URLEncoder.encode(name, StandardCharsets.UTF_8);
    }

    private static String extension(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    private static String describeMissing(String jobId, String filename) {
        return filename == null || filename.isBlank()
            ? "No output files for job " + jobId
            : "No output file '" + filename + "' for job " + jobId;
    }
}
