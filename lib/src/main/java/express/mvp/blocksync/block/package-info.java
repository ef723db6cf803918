/**
 * Remote block model: the closed set of editable {@link express.mvp.blocksync.block.BlockType
 * block types}, fetched {@link express.mvp.blocksync.block.BlockContent content} and save
 * {@link express.mvp.blocksync.block.BlockUpdate payloads}.
 */
package express.mvp.blocksync.block;
