package github.sarthakdev143.timeline_compiler.service;

import github.sarthakdev143.timeline_compiler.model.CompiledCommand;
import github.sarthakdev143.timeline_compiler.model.ExportJob;
import github.sarthakdev143.timeline_compiler.model.HardwareCapabilities;
import github.sarthakdev143.timeline_compiler.model.TrackDescriptor;

import java.util.List;

public interface TimelineCompilationService {

    CompiledCommand compile(List<TrackDescriptor> tracks, ExportJob job);

    HardwareCapabilities hardwareCapabilities();

    HardwareCapabilities refreshHardwareCapabilities();
}
