package edu.stanford.futuredata.geoshard.localcloud;

import edu.stanford.futuredata.geoshard.pipeline.ArtifactStore;

import java.io.File;

/** Pipeline outputs on the local disk. */
public class LocalArtifactStore implements ArtifactStore {

    @Override
    public boolean exists(String location) {
        File artifact = new File(location);
        File directory = artifact.getParentFile();
        if (directory == null || !directory.isDirectory()) {
            return false;
        }
        String[] matches = directory.list((dir, name) -> name.startsWith(artifact.getName()));
        return matches != null && matches.length > 0;
    }
}
